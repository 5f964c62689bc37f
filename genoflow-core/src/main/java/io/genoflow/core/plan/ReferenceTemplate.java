package io.genoflow.core.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;

/// Configuration text with one or more output references embedded in it,
/// e.g. `"${output.scoring.scores_file}.bak"`.
///
/// Resolution substitutes the string form of each referenced value. A string
/// that is exactly one reference is represented by {@link OutputReference}
/// instead, so it can resolve to a structured value.
///
/// @param template original text including reference expressions, not null
/// @param references references in order of appearance, not empty
public record ReferenceTemplate(String template, List<OutputReference> references) {

    public ReferenceTemplate {
        Objects.requireNonNull(template, "template must not be null");
        references = references != null ? List.copyOf(references) : List.of();
        if (references.isEmpty()) {
            throw new IllegalArgumentException("template contains no references: " + template);
        }
    }

    /// Parses text containing at least one reference.
    ///
    /// @param template text to parse, not null
    /// @return the parsed template, never null
    /// @throws IllegalArgumentException if the text contains no reference
    public static ReferenceTemplate parse(String template) {
        Objects.requireNonNull(template, "template must not be null");
        Matcher matcher = OutputReference.PATTERN.matcher(template);
        List<OutputReference> found = new ArrayList<>();
        while (matcher.find()) {
            found.add(new OutputReference(matcher.group(1), matcher.group(2)));
        }
        return new ReferenceTemplate(template, found);
    }

    /// Renders the template, replacing each reference with the text produced
    /// by `lookup`.
    ///
    /// @param lookup maps a reference to its replacement text, not null
    /// @return rendered text, never null
    public String render(Function<OutputReference, String> lookup) {
        Matcher matcher = OutputReference.PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        int literalStart = 0;
        while (matcher.find()) {
            OutputReference ref = new OutputReference(matcher.group(1), matcher.group(2));
            result.append(OutputReference.unescape(template.substring(literalStart, matcher.start())));
            result.append(lookup.apply(ref));
            literalStart = matcher.end();
        }
        result.append(OutputReference.unescape(template.substring(literalStart)));
        return result.toString();
    }

    @Override
    public String toString() {
        return template;
    }
}

package io.genoflow.core.plan;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Typed pointer from one task's configuration to another task's output.
///
/// Written in configuration text as `${output.<taskId>.<outputKey>}`; `$${` escapes
/// the syntax and stands for a literal `${`. Strings
/// are parsed into references once, when a {@link TaskSpec} is constructed, so
/// plan validation can check every reference against `dependsOn` statically.
///
/// ### Contracts
/// - **Precondition**: `taskId` and `outputKey` must not be null or blank;
///   `taskId` must not contain `.`
/// - **Postcondition**: `parse(ref.expression())` yields an equal reference
///
/// @param taskId id of the producing task, not null
/// @param outputKey key within the producer's outputs, not null
/// @see ReferenceTemplate for references embedded in longer text
/// @see ConfigValues for config parsing
public record OutputReference(String taskId, String outputKey) {

    /// Matches one reference anywhere in a string.
    static final Pattern PATTERN = Pattern.compile("(?<!\\$)\\$\\{output\\.([^.}\\s]+)\\.([^}\\s]+)}");

    public OutputReference {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(outputKey, "outputKey must not be null");
        if (taskId.isBlank() || outputKey.isBlank()) {
            throw new IllegalArgumentException("taskId and outputKey must not be blank");
        }
        if (taskId.contains(".")) {
            throw new IllegalArgumentException("taskId must not contain '.': " + taskId);
        }
    }

    /// Parses a string that consists of exactly one reference.
    ///
    /// @param text candidate expression, may be null
    /// @return the reference, or empty if `text` is not exactly one reference
    public static Optional<OutputReference> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new OutputReference(matcher.group(1), matcher.group(2)));
    }

    /// Returns whether a string contains at least one reference.
    ///
    /// @param text candidate text, may be null
    /// @return true if a reference occurs in `text`
    public static boolean containsReference(String text) {
        return text != null && PATTERN.matcher(text).find();
    }

    /// Escapes reference syntax so the text is kept literally: every `${` becomes `$${`.
    ///
    /// @param text literal text, not null
    /// @return escaped text, never null
    public static String escape(String text) {
        return text.replace("${", "$${");
    }

    /// Reverses {@link #escape(String)}.
    ///
    /// @param text escaped text, not null
    /// @return literal text, never null
    public static String unescape(String text) {
        return text.replace("$${", "${");
    }

    /// Returns the textual form of this reference.
    ///
    /// @return `${output.<taskId>.<outputKey>}`, never null
    public String expression() {
        return "${output." + taskId + "." + outputKey + "}";
    }

    @Override
    public String toString() {
        return expression();
    }
}

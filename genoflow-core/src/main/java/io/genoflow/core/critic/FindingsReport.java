package io.genoflow.core.critic;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Ordered findings of one consistency-checker invocation.
///
/// Purely derived from a plan and its results; regenerated on every check
/// and never mutated.
///
/// @param findings findings in check order, not null
/// @param generatedAt when the report was produced, not null
public record FindingsReport(List<Finding> findings, Instant generatedAt) {

    public FindingsReport {
        findings = findings != null ? List.copyOf(findings) : List.of();
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    /// Returns the overall verdict.
    ///
    /// @return `FAIL` if any error, `WARNING` if any warning, otherwise `PASS`
    public ReportStatus status() {
        if (count(Severity.ERROR) > 0) {
            return ReportStatus.FAIL;
        }
        return count(Severity.WARNING) > 0 ? ReportStatus.WARNING : ReportStatus.PASS;
    }

    public List<Finding> withSeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }

    public List<Finding> fromCheck(String check) {
        return findings.stream().filter(f -> f.check().equals(check)).toList();
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    public boolean hasErrors() {
        return status() == ReportStatus.FAIL;
    }
}

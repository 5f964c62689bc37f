package io.genoflow.core.critic;

/// Overall verdict of a findings report.
public enum ReportStatus {

    /// No warnings and no errors.
    PASS,

    /// At least one warning, no errors.
    WARNING,

    /// At least one error.
    FAIL
}

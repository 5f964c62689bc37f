package io.genoflow.core.critic;

/// Severity of a consistency finding.
public enum Severity {
    INFO,
    WARNING,
    ERROR
}

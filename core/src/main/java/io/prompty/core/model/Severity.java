package io.prompty.core.model;

/** Severity of a {@link ValidationIssue}. */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}

package com.leyesmx.domain.statute.model;

/**
 * Individual diagnostic produced while parsing or validating a statute.
 *
 * @param type        the kind of issue
 * @param severity    ERROR blocks the document from being written, WARNING is recorded only
 * @param message     human-readable description of the issue
 * @param matchedText the text that triggered this issue (nullable)
 */
public record ParseIssue(
        ParseIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public static ParseIssue error(ParseIssueType type, String message) {
        return new ParseIssue(type, Severity.ERROR, message, null);
    }

    public static ParseIssue warning(ParseIssueType type, String message) {
        return new ParseIssue(type, Severity.WARNING, message, null);
    }

    public static ParseIssue warning(ParseIssueType type, String message, String matchedText) {
        return new ParseIssue(type, Severity.WARNING, message, matchedText);
    }

    public boolean blocking() {
        return severity == Severity.ERROR;
    }
}

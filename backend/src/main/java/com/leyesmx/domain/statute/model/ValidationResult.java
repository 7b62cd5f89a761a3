package com.leyesmx.domain.statute.model;

import java.util.List;

/**
 * Result of statute validation.
 *
 * @param passed true if no ERROR-level issues were found
 * @param issues list of all validation issues (both ERROR and WARNING)
 */
public record ValidationResult(
        boolean passed,
        List<ParseIssue> issues
) {
    public static ValidationResult of(List<ParseIssue> issues) {
        List<ParseIssue> copy = List.copyOf(issues);
        return new ValidationResult(copy.stream().noneMatch(ParseIssue::blocking), copy);
    }

    public List<ParseIssue> errors() {
        return issues.stream().filter(ParseIssue::blocking).toList();
    }

    public List<ParseIssue> warnings() {
        return issues.stream().filter(i -> !i.blocking()).toList();
    }
}

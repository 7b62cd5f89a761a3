package com.leyesmx.application.statute.exception;

import com.leyesmx.domain.statute.model.ParseIssue;

import java.util.List;

public class StatuteRejectedException extends RuntimeException {

    private final List<ParseIssue> issues;

    public StatuteRejectedException(String message, List<ParseIssue> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }

    public List<ParseIssue> getIssues() {
        return issues;
    }
}

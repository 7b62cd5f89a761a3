package com.leyesmx.domain.statute.model;

import java.util.List;
import java.util.Optional;

/**
 * Final output of the parsing pipeline for one document.
 *
 * @param documentId base identifier of the source document
 * @param document   the assembled statute, null when a blocking issue rejected it
 * @param issues     every diagnostic raised along the way, blocking ones included
 */
public record ParseResult(
        String documentId,
        StatuteDocument document,
        List<ParseIssue> issues
) {
    public ParseResult {
        issues = List.copyOf(issues);
    }

    public boolean accepted() {
        return document != null;
    }

    public Optional<StatuteDocument> documentIfAccepted() {
        return Optional.ofNullable(document);
    }

    public List<ParseIssue> errors() {
        return issues.stream().filter(ParseIssue::blocking).toList();
    }

    public List<ParseIssue> warnings() {
        return issues.stream().filter(i -> !i.blocking()).toList();
    }

    /** Key under which the document is published in the output JSON. */
    public String outputKey() {
        return documentId + ".JSON";
    }
}

package com.leyesmx.interfaces.api.dto;

import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.StatuteDocument;

import java.util.List;
import java.util.Map;

/**
 * @param document the statute keyed by {@code "<documentId>.JSON"}, as in the batch output files
 * @param issues   non-blocking diagnostics
 */
public record ParseResponse(
        Map<String, StatuteDocument> document,
        List<ParseIssue> issues
) {
    public static ParseResponse from(ParseResult result) {
        return new ParseResponse(Map.of(result.outputKey(), result.document()), result.issues());
    }
}

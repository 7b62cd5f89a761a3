package com.leyesmx.application.conversion;

import java.util.List;

/**
 * Outcome of one batch run; also the content of {@code index.json}.
 */
public record BatchReport(
        String inputDir,
        String outputDir,
        List<DocumentOutcome> documents
) {
    public BatchReport {
        documents = List.copyOf(documents);
    }

    public long count(ConversionStatus status) {
        return documents.stream().filter(d -> d.status() == status).count();
    }
}

package com.leyesmx.application.conversion;

import com.leyesmx.domain.statute.model.ParseIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Manifest entry for one converted source file.
 *
 * @param base               base identifier of the document
 * @param sourceFile         source file name
 * @param status             conversion outcome
 * @param outputFile         written JSON, relative to the output directory; null unless WRITTEN
 * @param chapters           number of normative chapters
 * @param articles           number of normative articles
 * @param transitoryArticles number of transitory articles
 * @param issues             every diagnostic raised for the document
 */
public record DocumentOutcome(
        String base,
        String sourceFile,
        ConversionStatus status,
        String outputFile,
        int chapters,
        int articles,
        int transitoryArticles,
        List<ParseIssue> issues
) {
    public DocumentOutcome {
        issues = List.copyOf(issues);
    }

    public DocumentOutcome withIssue(ParseIssue issue) {
        List<ParseIssue> all = new ArrayList<>(issues);
        all.add(issue);
        return new DocumentOutcome(base, sourceFile, status, outputFile, chapters, articles, transitoryArticles, all);
    }

    public static DocumentOutcome failed(String base, String sourceFile, ParseIssue cause) {
        return new DocumentOutcome(base, sourceFile, ConversionStatus.FAILED, null, 0, 0, 0, List.of(cause));
    }
}

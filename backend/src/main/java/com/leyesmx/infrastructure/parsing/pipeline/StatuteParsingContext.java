package com.leyesmx.infrastructure.parsing.pipeline;

import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.DocumentMetadata;
import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.domain.statute.model.TransitoryChapter;
import com.leyesmx.domain.statute.model.ValidationResult;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed through the parsing stages of one document.
 * Never shared between documents.
 */
@Data
public class StatuteParsingContext {

    // --- Input ---
    private String documentId;
    private ParserSettings settings;

    // --- Preprocessing ---
    private SourceText source;
    private DocumentSegments segments;

    // --- Extraction ---
    private DocumentMetadata metadata;
    private List<Chapter> chapters = new ArrayList<>();
    private List<TransitoryChapter> transitorios = new ArrayList<>();

    // --- Assembly ---
    private StatuteDocument document;
    private ValidationResult validationResult;

    private final List<ParseIssue> issues = new ArrayList<>();

    public void report(ParseIssue issue) {
        issues.add(issue);
    }

    /**
     * Build the final ParseResult; the document is withheld when validation failed.
     */
    public ParseResult toParseResult() {
        boolean passed = validationResult != null && validationResult.passed();
        return new ParseResult(documentId, passed ? document : null, issues);
    }
}

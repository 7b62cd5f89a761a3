package com.leyesmx.infrastructure.parsing.pipeline;

import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.domain.statute.model.ValidationResult;
import com.leyesmx.infrastructure.parsing.metadata.MetadataExtractor;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import com.leyesmx.infrastructure.parsing.segmentation.DocumentSegmenter;
import com.leyesmx.infrastructure.parsing.structure.ArticleKeys;
import com.leyesmx.infrastructure.parsing.structure.HierarchyBuilder;
import com.leyesmx.infrastructure.parsing.structure.TransitoryExtractor;
import com.leyesmx.infrastructure.parsing.validation.StatuteValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orchestrates the parse of one statute:
 * <p>
 * clean → segment → metadata → chapters/articles/fractions → transitories → assemble → validate
 * </p>
 * Pure and synchronous. Every diagnostic raised by any stage ends up in the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatuteParsingPipeline {

    private final TextNormalizer textNormalizer;
    private final DocumentSegmenter documentSegmenter;
    private final MetadataExtractor metadataExtractor;
    private final HierarchyBuilder hierarchyBuilder;
    private final TransitoryExtractor transitoryExtractor;
    private final StatuteAssembler statuteAssembler;
    private final StatuteValidator statuteValidator;
    private final ParserSettings defaultSettings;

    /**
     * Parse with the configured settings.
     */
    public ParseResult parse(String documentId, String rawText) {
        return parse(documentId, rawText, defaultSettings);
    }

    public ParseResult parse(String documentId, String rawText, ParserSettings settings) {
        StatuteParsingContext ctx = new StatuteParsingContext();
        ctx.setDocumentId(documentId);
        ctx.setSettings(settings);

        // 1. Preprocess
        String cleaned = textNormalizer.clean(rawText == null ? "" : rawText);
        ctx.setSource(new SourceText(cleaned, textNormalizer.fold(cleaned)));

        // 2. Segment
        ctx.setSegments(documentSegmenter.segment(ctx.getSource(), ctx::report));

        // 3. Extract
        ctx.setMetadata(metadataExtractor.extract(ctx.getSource(), ctx.getSegments()));
        ctx.setChapters(hierarchyBuilder.build(ctx.getSource(), ctx.getSegments(), settings,
                new ArticleKeys(), ctx::report));
        ctx.setTransitorios(transitoryExtractor.extract(ctx.getSource(), ctx.getSegments(), ctx::report));

        // 4. Assemble + validate
        StatuteDocument document = statuteAssembler.assemble(
                ctx.getSegments(), ctx.getMetadata(), ctx.getChapters(), ctx.getTransitorios());
        ctx.setDocument(document);

        ValidationResult validation = statuteValidator.validate(document);
        ctx.setValidationResult(validation);
        validation.issues().forEach(ctx::report);

        if (!validation.passed()) {
            log.warn("Document {} rejected: {}", documentId,
                    validation.errors().stream().map(ParseIssue::message).toList());
        } else {
            log.info("Document {} parsed: {} chapters, {} articles, {} transitory articles",
                    documentId, document.capitulos().size(), document.articleCount(),
                    document.transitoryArticleCount());
        }
        long warnings = ctx.getIssues().stream().filter(i -> !i.blocking()).count();
        if (warnings > 0) {
            log.debug("Document {} carries {} warnings", documentId, warnings);
        }

        return ctx.toParseResult();
    }
}

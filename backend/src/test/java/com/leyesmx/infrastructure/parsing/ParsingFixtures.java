package com.leyesmx.infrastructure.parsing;

import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.metadata.MetadataExtractor;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.pipeline.StatuteAssembler;
import com.leyesmx.infrastructure.parsing.pipeline.StatuteParsingPipeline;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import com.leyesmx.infrastructure.parsing.segmentation.DocumentSegmenter;
import com.leyesmx.infrastructure.parsing.structure.ArticleExtractor;
import com.leyesmx.infrastructure.parsing.structure.FractionExtractor;
import com.leyesmx.infrastructure.parsing.structure.HierarchyBuilder;
import com.leyesmx.infrastructure.parsing.structure.TransitoryExtractor;
import com.leyesmx.infrastructure.parsing.validation.StatuteValidator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Hand-wired parsing components for tests.
 */
public final class ParsingFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private ParsingFixtures() {}

    public static SourceText source(String raw) {
        TextNormalizer normalizer = new TextNormalizer();
        String cleaned = normalizer.clean(raw);
        return new SourceText(cleaned, normalizer.fold(cleaned));
    }

    public static StatuteParsingPipeline pipeline(ParserSettings defaults) {
        TextNormalizer normalizer = new TextNormalizer();
        MarkerScanner scanner = new MarkerScanner(normalizer);
        FractionExtractor fractionExtractor = new FractionExtractor(scanner, normalizer);
        ArticleExtractor articleExtractor = new ArticleExtractor(scanner, fractionExtractor, normalizer);
        return new StatuteParsingPipeline(
                normalizer,
                new DocumentSegmenter(scanner),
                new MetadataExtractor(normalizer, scanner, FIXED_CLOCK),
                new HierarchyBuilder(scanner, articleExtractor),
                new TransitoryExtractor(scanner, fractionExtractor, normalizer),
                new StatuteAssembler(normalizer),
                new StatuteValidator(FIXED_CLOCK),
                defaults
        );
    }

    public static StatuteParsingPipeline pipeline() {
        return pipeline(ParserSettings.defaults());
    }
}

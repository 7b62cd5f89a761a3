package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.domain.statute.model.TransitoryArticle;
import com.leyesmx.domain.statute.model.TransitoryChapter;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.pattern.OrdinalVocabulary;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Extracts the transitory provisions into a single "Capítulo Único".
 * <p>
 * Articles are numbered by ordinal words. Every transitory heading in the block,
 * including the ones that open the transitories of later reform decrees, ends the
 * article before it and is not part of any text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransitoryExtractor {

    private final MarkerScanner markerScanner;
    private final FractionExtractor fractionExtractor;
    private final TextNormalizer textNormalizer;

    /**
     * @return an empty list when the block is missing or holds no article; otherwise one chapter
     */
    public List<TransitoryChapter> extract(SourceText source, DocumentSegments segments, Consumer<ParseIssue> issues) {
        if (!segments.hasTrans()) {
            return List.of();
        }
        int from = segments.transStart();
        int to = source.length();

        List<Marker> cuts = markerScanner.transitoryHeaders(source, from, to);
        List<Marker> headers = mergeWrappedHeaders(source, markerScanner.transitoryArticles(source, from, to));
        BodyPartitioner.Partition partition = BodyPartitioner.partition(source, headers, cuts, from, to);

        for (BodyPartitioner.Gap gap : partition.orphans()) {
            String text = textNormalizer.collapseWhitespace(source.slice(gap.start(), gap.end()));
            issues.accept(ParseIssue.warning(ParseIssueType.ORPHAN_TEXT,
                    "Text outside any transitory article at offset " + gap.start(),
                    ArticleExtractor.snippet(text)));
        }

        List<TransitoryArticle> articles = new ArrayList<>(partition.spans().size());
        for (BodyPartitioner.Span span : partition.spans()) {
            Marker header = span.header();
            if (OrdinalVocabulary.resolve(header.label()).isEmpty()) {
                issues.accept(ParseIssue.warning(ParseIssueType.UNRESOLVED_ORDINAL,
                        "Transitory ordinal kept as written: " + header.label(), header.label()));
            }
            FractionSplit split = fractionExtractor.split(source, span.bodyStart(), span.bodyEnd(),
                    "Transitorio " + header.token(), issues);
            articles.add(new TransitoryArticle(header.token(), split.texto(), split.fracciones()));
        }

        if (articles.isEmpty()) {
            log.debug("Transitory block at offset {} holds no article", from);
            return List.of();
        }
        return List.of(new TransitoryChapter(Chapter.FALLBACK_LABEL, articles));
    }

    private List<Marker> mergeWrappedHeaders(SourceText source, List<Marker> headers) {
        List<Marker> kept = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            Marker current = headers.get(i);
            if (i + 1 < headers.size()) {
                Marker next = headers.get(i + 1);
                if (current.token().equals(next.token()) && source.isBlank(current.end(), next.start())) {
                    continue;
                }
            }
            kept.add(current);
        }
        return kept;
    }
}

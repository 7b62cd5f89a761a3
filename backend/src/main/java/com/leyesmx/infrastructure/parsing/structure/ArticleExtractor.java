package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.ArticleKey;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Extracts the normative articles of one chapter body.
 * <p>
 * Every header opens its own article, so "Artículo 5" and "Artículo 5 Bis" are two
 * siblings exposing number 5. The only merge is a header repeated with nothing but
 * whitespace before its twin (a line-wrap artifact): the two become one article.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArticleExtractor {

    private final MarkerScanner markerScanner;
    private final FractionExtractor fractionExtractor;
    private final TextNormalizer textNormalizer;

    private static final int SNIPPET_LENGTH = 80;

    /**
     * @param source document text
     * @param from   start of the chapter body
     * @param to     end of the chapter body
     * @param cuts   dropped headings inside the body; each one ends the preceding article
     * @param keys   per-document key registry
     * @param issues receives sequence, duplicate and orphan-text warnings
     */
    public List<ExtractedArticle> extract(SourceText source, int from, int to, List<Marker> cuts,
                                          ArticleKeys keys, Consumer<ParseIssue> issues) {
        List<Marker> headers = mergeWrappedHeaders(source, markerScanner.articleHeaders(source, from, to));
        BodyPartitioner.Partition partition = BodyPartitioner.partition(source, headers, cuts, from, to);

        reportOrphans(source, partition.orphans(), issues);

        List<ExtractedArticle> articles = new ArrayList<>(partition.spans().size());
        ArticleKey previous = null;
        for (BodyPartitioner.Span span : partition.spans()) {
            Marker header = span.header();
            ArticleKey key = keys.next(header.number(), header.token());

            if (key.occurrence() > 0) {
                issues.accept(ParseIssue.warning(ParseIssueType.DUPLICATE_ARTICLE,
                        "Article " + key + " repeats an earlier heading", header.label()));
            }
            if (previous != null && key.number() < previous.number()) {
                issues.accept(ParseIssue.warning(ParseIssueType.ARTICLE_SEQUENCE,
                        "Article " + key + " follows article " + previous, header.label()));
            }

            FractionSplit split = fractionExtractor.split(source, span.bodyStart(), span.bodyEnd(),
                    "Artículo " + key, issues);
            articles.add(new ExtractedArticle(key, new Article(key.number(), split.texto(), split.fracciones())));
            previous = key;
        }
        return articles;
    }

    /**
     * Drops a header when the next one repeats the same number and suffix with only
     * whitespace in between.
     */
    private List<Marker> mergeWrappedHeaders(SourceText source, List<Marker> headers) {
        List<Marker> kept = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            Marker current = headers.get(i);
            if (i + 1 < headers.size()) {
                Marker next = headers.get(i + 1);
                if (current.number() == next.number()
                        && current.token().equals(next.token())
                        && source.isBlank(current.end(), next.start())) {
                    log.debug("Merging repeated heading \"{}\" at offset {}", current.label(), current.start());
                    continue;
                }
            }
            kept.add(current);
        }
        return kept;
    }

    private void reportOrphans(SourceText source, List<BodyPartitioner.Gap> orphans, Consumer<ParseIssue> issues) {
        for (BodyPartitioner.Gap gap : orphans) {
            String text = textNormalizer.collapseWhitespace(source.slice(gap.start(), gap.end()));
            issues.accept(ParseIssue.warning(ParseIssueType.ORPHAN_TEXT,
                    "Text outside any article at offset " + gap.start(), snippet(text)));
        }
    }

    static String snippet(String text) {
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "…";
    }
}

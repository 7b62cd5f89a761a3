package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.HierarchyLevel;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.OtherLevelHeaderPolicy;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.domain.statute.model.SplitLevel;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Groups the normative body into chapters at a single hierarchy level.
 * <p>
 * Each heading of the split level opens a chapter that runs to the next one. Headings of
 * other levels are either cut out of the text (and end the article before them) or left
 * inside it, depending on {@link OtherLevelHeaderPolicy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HierarchyBuilder {

    private final MarkerScanner markerScanner;
    private final ArticleExtractor articleExtractor;

    public List<Chapter> build(SourceText source, DocumentSegments segments, ParserSettings settings,
                               ArticleKeys keys, Consumer<ParseIssue> issues) {
        int from = segments.normaStart();
        int to = segments.transStart();
        if (from >= to) {
            return List.of();
        }

        List<Marker> levelHeaders = markerScanner.levelHeaders(source, from, to);
        Optional<HierarchyLevel> splitLevel = resolveSplitLevel(settings.splitLevel(), levelHeaders);

        List<Marker> splitHeaders = new ArrayList<>();
        List<Marker> otherHeaders = new ArrayList<>();
        for (Marker header : levelHeaders) {
            if (splitLevel.isPresent() && header.level() == splitLevel.get()) {
                splitHeaders.add(header);
            } else {
                otherHeaders.add(header);
            }
        }
        List<Marker> cuts = settings.otherLevelHeaders() == OtherLevelHeaderPolicy.DROP ? otherHeaders : List.of();

        List<Chapter> chapters = new ArrayList<>();
        if (splitHeaders.isEmpty()) {
            log.debug("No {} headings in the normative body; using a single chapter",
                    splitLevel.map(Enum::name).orElse("level"));
            chapters.add(new Chapter(Chapter.FALLBACK_LABEL,
                    articles(source, from, to, cuts, keys, issues)));
        } else {
            log.debug("Splitting the normative body at {} {} headings", splitHeaders.size(), splitLevel.get());
            List<Article> leading = articles(source, from, splitHeaders.get(0).start(), cuts, keys, issues);
            if (!leading.isEmpty()) {
                chapters.add(new Chapter(Chapter.FALLBACK_LABEL, leading));
            }
            for (int i = 0; i < splitHeaders.size(); i++) {
                Marker header = splitHeaders.get(i);
                int bodyEnd = i + 1 < splitHeaders.size() ? splitHeaders.get(i + 1).start() : to;
                int bodyStart = Math.min(header.end(), bodyEnd);
                chapters.add(new Chapter(header.label(), articles(source, bodyStart, bodyEnd, cuts, keys, issues)));
            }
        }

        if (!settings.discardEmptyChapters()) {
            return chapters;
        }
        List<Chapter> kept = chapters.stream().filter(c -> !c.articulos().isEmpty()).toList();
        if (kept.size() < chapters.size()) {
            log.debug("Discarded {} chapters without articles", chapters.size() - kept.size());
        }
        return kept;
    }

    /**
     * The configured level, or for AUTO the first level of the precedence list that
     * appears in the body. Empty when AUTO finds no level heading at all.
     */
    static Optional<HierarchyLevel> resolveSplitLevel(SplitLevel configured, List<Marker> levelHeaders) {
        if (configured.fixedLevel().isPresent()) {
            return configured.fixedLevel();
        }
        for (HierarchyLevel candidate : SplitLevel.AUTO_PRECEDENCE) {
            if (levelHeaders.stream().anyMatch(h -> h.level() == candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<Article> articles(SourceText source, int from, int to, List<Marker> cuts,
                                   ArticleKeys keys, Consumer<ParseIssue> issues) {
        return articleExtractor.extract(source, from, to, cuts, keys, issues).stream()
                .map(ExtractedArticle::article)
                .toList();
    }
}

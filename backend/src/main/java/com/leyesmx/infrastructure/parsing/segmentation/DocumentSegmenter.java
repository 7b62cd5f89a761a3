package com.leyesmx.infrastructure.parsing.segmentation;

import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Splits a statute into Decreto, Norma and Trans.
 * <p>
 * Norma starts at the first level header or article header; Trans starts at the first
 * transitory header after that point. Everything before Norma is the enacting decree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentSegmenter {

    private final MarkerScanner markerScanner;

    /**
     * @param source cleaned text with its matching view
     * @param issues receives an EMPTY_NORMATIVE_BODY warning when no normative content exists
     */
    public DocumentSegments segment(SourceText source, Consumer<ParseIssue> issues) {
        int length = source.length();
        int normaStart = findNormaStart(source);

        if (normaStart < 0) {
            log.debug("No level or article header found; everything before the transitory block is preamble");
            issues.accept(ParseIssue.warning(ParseIssueType.EMPTY_NORMATIVE_BODY,
                    "No normative body: no article or level header was found"));
            List<Marker> transitoryHeaders = markerScanner.transitoryHeaders(source, 0, length);
            int transStart = transitoryHeaders.isEmpty() ? length : transitoryHeaders.get(0).start();
            return new DocumentSegments(source.original(), transStart, transStart);
        }

        List<Marker> transitoryHeaders = markerScanner.transitoryHeaders(source, normaStart, length);
        int transStart = transitoryHeaders.isEmpty() ? length : transitoryHeaders.get(0).start();

        DocumentSegments segments = new DocumentSegments(source.original(), normaStart, transStart);
        log.debug("Segmented: decreto=[0,{}), norma=[{},{}), trans=[{},{})",
                normaStart, normaStart, transStart, transStart, length);
        return segments;
    }

    private int findNormaStart(SourceText source) {
        int length = source.length();
        List<Marker> levels = markerScanner.levelHeaders(source, 0, length);
        List<Marker> articles = markerScanner.articleHeaders(source, 0, length);
        int first = -1;
        if (!levels.isEmpty()) {
            first = levels.get(0).start();
        }
        if (!articles.isEmpty() && (first < 0 || articles.get(0).start() < first)) {
            first = articles.get(0).start();
        }
        return first;
    }
}

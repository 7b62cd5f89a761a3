package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Fraction;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.pattern.RomanNumerals;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits an article body into its own text and its roman-numbered fractions.
 * Out-of-sequence numerals are reported but never block the split.
 */
@Component
@RequiredArgsConstructor
public class FractionExtractor {

    private final MarkerScanner markerScanner;
    private final TextNormalizer textNormalizer;

    /**
     * @param source  the document
     * @param from    start of the article body (just after its header)
     * @param to      end of the article body
     * @param context article reference used in diagnostics, e.g. "Artículo 5 BIS"
     * @param issues  receives FRACTION_SEQUENCE warnings
     */
    public FractionSplit split(SourceText source, int from, int to, String context, Consumer<ParseIssue> issues) {
        List<Marker> markers = markerScanner.fractionMarkers(source, from, to);
        if (markers.isEmpty()) {
            return new FractionSplit(textNormalizer.collapseWhitespace(source.slice(from, to)), List.of());
        }

        String texto = textNormalizer.collapseWhitespace(source.slice(from, markers.get(0).start()));
        List<Fraction> fracciones = new ArrayList<>(markers.size());
        int previous = 0;
        for (int i = 0; i < markers.size(); i++) {
            Marker marker = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1).start() : to;
            fracciones.add(new Fraction(marker.label(),
                    textNormalizer.collapseWhitespace(source.slice(Math.min(marker.end(), end), end))));

            int value = RomanNumerals.toInt(marker.label());
            if (value != previous + 1) {
                issues.accept(ParseIssue.warning(ParseIssueType.FRACTION_SEQUENCE,
                        String.format("%s: fraction %s follows %s", context, marker.label(),
                                previous == 0 ? "the article text" : RomanNumerals.toRoman(previous)),
                        marker.label()));
            }
            previous = value;
        }
        return new FractionSplit(texto, fracciones);
    }
}

package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.SourceText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Partitions a body [from, to) at header markers. Each article header owns the text up
 * to the next marker or the end of the body. Cuts (level or transitory block headings)
 * own nothing; non-blank text that no header owns is returned as an orphan gap.
 */
final class BodyPartitioner {

    record Span(Marker header, int bodyStart, int bodyEnd) {}

    record Gap(int start, int end) {}

    record Partition(List<Span> spans, List<Gap> orphans) {}

    private BodyPartitioner() {}

    static Partition partition(SourceText source, List<Marker> headers, List<Marker> cuts, int from, int to) {
        List<Marker> markers = new ArrayList<>(headers.size() + cuts.size());
        markers.addAll(headers);
        for (Marker cut : cuts) {
            if (cut.start() >= from && cut.start() < to) {
                markers.add(cut);
            }
        }
        markers.sort(Comparator.comparingInt(Marker::start));

        List<Span> spans = new ArrayList<>();
        List<Gap> orphans = new ArrayList<>();

        int firstStart = markers.isEmpty() ? to : markers.get(0).start();
        addIfNotBlank(source, from, firstStart, orphans);

        for (int i = 0; i < markers.size(); i++) {
            Marker marker = markers.get(i);
            int next = i + 1 < markers.size() ? markers.get(i + 1).start() : to;
            int bodyStart = Math.min(marker.end(), next);
            if (ownsText(marker)) {
                spans.add(new Span(marker, bodyStart, next));
            } else {
                addIfNotBlank(source, bodyStart, next, orphans);
            }
        }
        return new Partition(spans, orphans);
    }

    /**
     * Article headers open a body; level and block headings only end the one before them.
     */
    static boolean ownsText(Marker marker) {
        return switch (marker.type()) {
            case ARTICLE_HEADER, TRANSITORY_ARTICLE -> true;
            case LEVEL_HEADER, TRANSITORY_HEADER -> false;
            case FRACTION_MARKER -> throw new IllegalArgumentException(
                    "Fraction markers do not partition a body: " + marker.label());
        };
    }

    private static void addIfNotBlank(SourceText source, int start, int end, List<Gap> out) {
        if (start < end && !source.isBlank(start, end)) {
            out.add(new Gap(start, end));
        }
    }
}

package com.leyesmx.domain.statute.model;

/**
 * A structural marker located in the source text.
 * Offsets are in original-text coordinates, end exclusive.
 *
 * @param type   marker class
 * @param start  start of the matched header or marker
 * @param end    end of the header including its delimiter; the marked body starts here
 * @param label  level heading text, fraction numeral or transitory ordinal as written
 * @param level  hierarchy level, only for {@link MarkerType#LEVEL_HEADER}
 * @param number article number, only for {@link MarkerType#ARTICLE_HEADER}; -1 otherwise
 * @param token  article suffix ("BIS", "A"), or the canonical transitory ordinal; empty otherwise
 */
public record Marker(
        MarkerType type,
        int start,
        int end,
        String label,
        HierarchyLevel level,
        int number,
        String token
) {
    public static Marker levelHeader(int start, int end, String label, HierarchyLevel level) {
        return new Marker(MarkerType.LEVEL_HEADER, start, end, label, level, -1, "");
    }

    public static Marker articleHeader(int start, int end, String label, int number, String suffix) {
        return new Marker(MarkerType.ARTICLE_HEADER, start, end, label, null, number, suffix);
    }

    public static Marker fraction(int start, int end, String numeral) {
        return new Marker(MarkerType.FRACTION_MARKER, start, end, numeral, null, -1, "");
    }

    public static Marker transitoryHeader(int start, int end, String label) {
        return new Marker(MarkerType.TRANSITORY_HEADER, start, end, label, null, -1, "");
    }

    public static Marker transitoryArticle(int start, int end, String label, String ordinal) {
        return new Marker(MarkerType.TRANSITORY_ARTICLE, start, end, label, null, -1, ordinal);
    }
}

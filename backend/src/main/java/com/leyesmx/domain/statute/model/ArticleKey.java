package com.leyesmx.domain.statute.model;

/**
 * Internal identity of a normative article.
 *
 * @param number     integer parsed from the header
 * @param suffix     upper-cased suffix ("BIS", "TER", "A"), empty when absent
 * @param occurrence 0-based count of earlier articles with the same number and suffix
 */
public record ArticleKey(int number, String suffix, int occurrence) {

    @Override
    public String toString() {
        String base = suffix.isEmpty() ? String.valueOf(number) : number + " " + suffix;
        return occurrence == 0 ? base : base + "#" + occurrence;
    }
}

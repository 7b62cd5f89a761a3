package com.leyesmx.domain.statute.model;

/**
 * Disjoint, order-preserving split of a cleaned statute text.
 * Decreto is [0, normaStart), Norma is [normaStart, transStart), Trans is [transStart, length).
 * Without a normative body normaStart equals transStart equals the text length.
 */
public record DocumentSegments(String text, int normaStart, int transStart) {

    public DocumentSegments {
        if (normaStart < 0 || normaStart > transStart || transStart > text.length()) {
            throw new IllegalArgumentException(
                    "Invalid segment bounds: norma=" + normaStart + ", trans=" + transStart + ", length=" + text.length());
        }
    }

    public String decreto() {
        return text.substring(0, normaStart);
    }

    public String norma() {
        return text.substring(normaStart, transStart);
    }

    public String trans() {
        return text.substring(transStart);
    }

    public boolean hasNorma() {
        return transStart > normaStart && !norma().isBlank();
    }

    public boolean hasTrans() {
        return transStart < text.length();
    }
}

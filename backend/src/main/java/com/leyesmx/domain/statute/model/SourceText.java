package com.leyesmx.domain.statute.model;

/**
 * A cleaned statute text paired with its length-preserving matching view.
 * Offsets are shared: position i in {@code folded} corresponds to position i in {@code original}.
 */
public record SourceText(String original, String folded) {

    public SourceText {
        if (original.length() != folded.length()) {
            throw new IllegalArgumentException("Matching view must preserve length");
        }
    }

    public int length() {
        return original.length();
    }

    public String slice(int start, int end) {
        return original.substring(start, end);
    }

    public boolean isBlank(int start, int end) {
        for (int i = start; i < end; i++) {
            if (folded.charAt(i) != ' ' && folded.charAt(i) != '\n') {
                return false;
            }
        }
        return true;
    }
}

package com.leyesmx.domain.statute.model;

/**
 * Front-matter inferred from the preamble and the opening of the normative body.
 *
 * @param titulo          official title, empty when no heuristic fired
 * @param anioPublicacion publication year, null when none was found
 */
public record DocumentMetadata(String titulo, Integer anioPublicacion) {

    public static final int MIN_YEAR = 1850;
}

package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Fraction;

import java.util.List;

/**
 * An article body divided into its own text and its fractions.
 *
 * @param texto      whitespace-collapsed text before the first fraction marker
 * @param fracciones fractions in source order
 */
public record FractionSplit(String texto, List<Fraction> fracciones) {

    public FractionSplit {
        fracciones = List.copyOf(fracciones);
    }
}

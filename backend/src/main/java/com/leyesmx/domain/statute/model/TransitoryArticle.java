package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A transitory article, numbered by a textual ordinal ("Único", "Primero", ...).
 * Ordinals that could not be resolved are kept verbatim.
 */
@JsonPropertyOrder({"Artículo", "Texto", "Fracciones"})
public record TransitoryArticle(
        @JsonProperty("Artículo") String ordinal,
        @JsonProperty("Texto") String texto,
        @JsonProperty("Fracciones") List<Fraction> fracciones
) {
    public TransitoryArticle {
        fracciones = List.copyOf(fracciones);
    }
}

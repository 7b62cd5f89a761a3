package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A permanent (normative) article. Suffixed variants such as "5 Bis" expose the
 * same {@code numero} as "5"; their identity lives in {@link ArticleKey}, which
 * is never serialized.
 */
@JsonPropertyOrder({"Artículo", "Texto", "Fracciones"})
public record Article(
        @JsonProperty("Artículo") int numero,
        @JsonProperty("Texto") String texto,
        @JsonProperty("Fracciones") List<Fraction> fracciones
) {
    public Article {
        fracciones = List.copyOf(fracciones);
    }
}

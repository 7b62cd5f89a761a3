package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"Capítulo", "Artículos"})
public record Chapter(
        @JsonProperty("Capítulo") String label,
        @JsonProperty("Artículos") List<Article> articulos
) {
    public static final String FALLBACK_LABEL = "Capítulo Único";

    public Chapter {
        articulos = List.copyOf(articulos);
    }
}

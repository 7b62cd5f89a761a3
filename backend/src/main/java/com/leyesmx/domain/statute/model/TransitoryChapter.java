package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"Capítulo", "Artículos"})
public record TransitoryChapter(
        @JsonProperty("Capítulo") String label,
        @JsonProperty("Artículos") List<TransitoryArticle> articulos
) {
    public TransitoryChapter {
        articulos = List.copyOf(articulos);
    }
}

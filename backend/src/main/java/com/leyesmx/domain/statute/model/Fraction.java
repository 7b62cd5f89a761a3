package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"Fracción", "Texto"})
public record Fraction(
        @JsonProperty("Fracción") String label,
        @JsonProperty("Texto") String texto
) {}

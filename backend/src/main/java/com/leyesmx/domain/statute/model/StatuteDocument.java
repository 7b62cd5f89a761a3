package com.leyesmx.domain.statute.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of the structured representation of one statute.
 *
 * @param decreto             enacting preamble preceding the normative body, possibly empty
 * @param anioPublicacion     inferred publication year, null when nothing was found
 * @param titulo              official name of the statute, possibly empty
 * @param capitulos           permanent provisions grouped by chapter, in source order
 * @param transitorios        zero or one transitory chapter
 */
@JsonPropertyOrder({"Decreto", "Año_publicación", "Título", "Capítulos", "Transitorios"})
public record StatuteDocument(
        @JsonProperty("Decreto") String decreto,
        @JsonProperty("Año_publicación") @JsonInclude(JsonInclude.Include.ALWAYS) Integer anioPublicacion,
        @JsonProperty("Título") String titulo,
        @JsonProperty("Capítulos") List<Chapter> capitulos,
        @JsonProperty("Transitorios") List<TransitoryChapter> transitorios
) {
    public StatuteDocument {
        capitulos = List.copyOf(capitulos);
        transitorios = List.copyOf(transitorios);
    }

    public int articleCount() {
        return capitulos.stream().mapToInt(c -> c.articulos().size()).sum();
    }

    public int transitoryArticleCount() {
        return transitorios.stream().mapToInt(c -> c.articulos().size()).sum();
    }
}

package com.leyesmx.domain.statute.model;

public enum MarkerType {
    LEVEL_HEADER,
    ARTICLE_HEADER,
    FRACTION_MARKER,
    TRANSITORY_HEADER,
    TRANSITORY_ARTICLE
}

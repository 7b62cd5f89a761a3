package com.leyesmx.domain.statute.model;

public enum ParseIssueType {
    STRUCTURAL_FAILURE,
    RANGE_VIOLATION,
    SHAPE_VIOLATION,
    EMPTY_TITLE,
    EMPTY_DECREE,
    NO_TRANSITORIES,
    EMPTY_NORMATIVE_BODY,
    ARTICLE_SEQUENCE,
    DUPLICATE_ARTICLE,
    FRACTION_SEQUENCE,
    ORPHAN_TEXT,
    UNRESOLVED_ORDINAL,
    DUPLICATE_BASE_ID
}

package com.leyesmx.domain.statute.model;

/**
 * Grouping levels above the article, from the broadest to the narrowest.
 */
public enum HierarchyLevel {
    LIBRO,
    TITULO,
    CAPITULO,
    SECCION
}

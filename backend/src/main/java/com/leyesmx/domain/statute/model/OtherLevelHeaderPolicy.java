package com.leyesmx.domain.statute.model;

/**
 * What to do with level headers that are not at the chosen split level
 * (e.g. a "SECCIÓN" inside a document split by "CAPÍTULO").
 */
public enum OtherLevelHeaderPolicy {
    /** Excise the heading from article text; it ends the preceding article. */
    DROP,
    /** Leave the heading inside the surrounding article or fraction text. */
    KEEP_IN_TEXT
}

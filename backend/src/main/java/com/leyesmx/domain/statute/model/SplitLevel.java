package com.leyesmx.domain.statute.model;

import java.util.List;
import java.util.Optional;

/**
 * Level at which the normative body is split into chapters.
 * AUTO picks the first level present, in {@link #AUTO_PRECEDENCE} order.
 */
public enum SplitLevel {
    AUTO(null),
    LIBRO(HierarchyLevel.LIBRO),
    TITULO(HierarchyLevel.TITULO),
    CAPITULO(HierarchyLevel.CAPITULO),
    SECCION(HierarchyLevel.SECCION);

    public static final List<HierarchyLevel> AUTO_PRECEDENCE = List.of(
            HierarchyLevel.CAPITULO,
            HierarchyLevel.SECCION,
            HierarchyLevel.TITULO,
            HierarchyLevel.LIBRO
    );

    private final HierarchyLevel level;

    SplitLevel(HierarchyLevel level) {
        this.level = level;
    }

    public Optional<HierarchyLevel> fixedLevel() {
        return Optional.ofNullable(level);
    }
}

package com.leyesmx.domain.statute.model;

import java.util.Objects;

/**
 * Read-only parser configuration, created once per run and passed into every parse call.
 */
public record ParserSettings(
        SplitLevel splitLevel,
        OtherLevelHeaderPolicy otherLevelHeaders,
        boolean discardEmptyChapters
) {
    public ParserSettings {
        Objects.requireNonNull(splitLevel, "splitLevel");
        Objects.requireNonNull(otherLevelHeaders, "otherLevelHeaders");
    }

    public static ParserSettings defaults() {
        return new ParserSettings(SplitLevel.AUTO, OtherLevelHeaderPolicy.DROP, true);
    }

    public ParserSettings withSplitLevel(SplitLevel level) {
        return new ParserSettings(level, otherLevelHeaders, discardEmptyChapters);
    }

    public ParserSettings withDiscardEmptyChapters(boolean discard) {
        return new ParserSettings(splitLevel, otherLevelHeaders, discard);
    }

    public ParserSettings withOtherLevelHeaders(OtherLevelHeaderPolicy policy) {
        return new ParserSettings(splitLevel, policy, discardEmptyChapters);
    }
}

package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.ArticleKey;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out {@link ArticleKey}s for one document, numbering repeated
 * (number, suffix) pairs with an increasing occurrence index.
 * One instance per parse; never shared between documents.
 */
public class ArticleKeys {

    private final Map<String, Integer> seen = new HashMap<>();

    public ArticleKey next(int number, String suffix) {
        String heading = number + "|" + suffix;
        int occurrence = seen.merge(heading, 1, Integer::sum) - 1;
        return new ArticleKey(number, suffix, occurrence);
    }
}

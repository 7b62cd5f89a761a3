package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.ArticleKey;

/**
 * An exported article together with its internal identity.
 */
public record ExtractedArticle(ArticleKey key, Article article) {}

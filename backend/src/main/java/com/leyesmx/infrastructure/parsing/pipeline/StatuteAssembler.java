package com.leyesmx.infrastructure.parsing.pipeline;

import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.DocumentMetadata;
import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.domain.statute.model.TransitoryChapter;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the immutable {@link StatuteDocument} from the pieces the extractors produced.
 */
@Component
@RequiredArgsConstructor
public class StatuteAssembler {

    private final TextNormalizer textNormalizer;

    public StatuteDocument assemble(DocumentSegments segments,
                                    DocumentMetadata metadata,
                                    List<Chapter> chapters,
                                    List<TransitoryChapter> transitorios) {
        return new StatuteDocument(
                textNormalizer.collapseWhitespace(segments.decreto()),
                metadata.anioPublicacion(),
                metadata.titulo() == null ? "" : metadata.titulo(),
                chapters,
                transitorios
        );
    }
}

package com.leyesmx.application.statute;

import com.leyesmx.application.statute.exception.StatuteRejectedException;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SplitLevel;
import com.leyesmx.infrastructure.parsing.pipeline.StatuteParsingPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StatuteAppService {

    private final StatuteParsingPipeline parsingPipeline;
    private final ParserSettings parserSettings;

    /**
     * Parse one submitted statute. Request values override the configured settings.
     *
     * @throws StatuteRejectedException when a blocking diagnostic withheld the document
     */
    public ParseResult parse(String documentId, String text, SplitLevel splitLevel, Boolean discardEmptyChapters) {
        ParserSettings settings = parserSettings;
        if (splitLevel != null) {
            settings = settings.withSplitLevel(splitLevel);
        }
        if (discardEmptyChapters != null) {
            settings = settings.withDiscardEmptyChapters(discardEmptyChapters);
        }

        ParseResult result = parsingPipeline.parse(documentId, text, settings);
        if (!result.accepted()) {
            throw new StatuteRejectedException(
                    String.format("El documento %s no tiene una estructura válida.", documentId),
                    result.issues());
        }
        return result;
    }
}

package com.leyesmx.infrastructure.config;

import com.leyesmx.domain.statute.model.OtherLevelHeaderPolicy;
import com.leyesmx.domain.statute.model.ParserSettings;
import com.leyesmx.domain.statute.model.SplitLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ParserConfig {

    @Value("${parser.split-level:AUTO}")
    private SplitLevel splitLevel;

    @Value("${parser.other-level-headers:DROP}")
    private OtherLevelHeaderPolicy otherLevelHeaders;

    @Value("${parser.discard-empty-chapters:true}")
    private boolean discardEmptyChapters;

    @Bean
    public ParserSettings parserSettings() {
        ParserSettings settings = new ParserSettings(splitLevel, otherLevelHeaders, discardEmptyChapters);
        log.info("Parser settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

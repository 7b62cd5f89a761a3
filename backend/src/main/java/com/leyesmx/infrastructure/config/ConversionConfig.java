package com.leyesmx.infrastructure.config;

import com.leyesmx.application.conversion.BatchSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConversionConfig {

    @Value("${conversion.batch.input-dir:}")
    private String inputDir;

    @Value("${conversion.batch.output-dir:Refined}")
    private String outputDir;

    @Value("${conversion.batch.file-glob:*.txt}")
    private String fileGlob;

    @Value("${conversion.batch.parallelism:4}")
    private int parallelism;

    @Bean
    public BatchSettings batchSettings() {
        return new BatchSettings(inputDir, outputDir, fileGlob, Math.max(1, parallelism));
    }
}

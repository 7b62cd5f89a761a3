package com.leyesmx.application.conversion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs a batch conversion on startup when {@code conversion.batch.input-dir} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchConversionRunner implements ApplicationRunner {

    private final BatchConversionService batchConversionService;
    private final BatchSettings batchSettings;

    @Override
    public void run(ApplicationArguments args) {
        if (!batchSettings.hasInputDir()) {
            log.debug("No conversion.batch.input-dir configured, skipping batch conversion");
            return;
        }
        BatchReport report = batchConversionService.convertDirectory(
                Path.of(batchSettings.inputDir()), Path.of(batchSettings.outputDir()));
        log.info("Startup batch: {} documents, {} written", report.documents().size(),
                report.count(ConversionStatus.WRITTEN));
    }
}

package com.leyesmx.application.conversion;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Append-only conversion log ({@code logs.txt}), one line per event:
 * {@code [yyyy-MM-dd HH:mm:ss] LEVEL base: message}.
 * Safe to share between the workers of one batch. A line that cannot be written is
 * reported through SLF4J and does not fail the document it belongs to.
 */
@Slf4j
public class ConversionLog {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Clock clock;

    public ConversionLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public void inicio(String base, String message) {
        append("INICIO", base, message);
    }

    public void success(String base, String message) {
        append("SUCCESS", base, message);
    }

    public void error(String base, String message) {
        append("ERROR", base, message);
    }

    public void info(String base, String message) {
        append("INFO", base, message);
    }

    public void warn(String base, String message) {
        append("WARN", base, message);
    }

    private synchronized void append(String level, String base, String message) {
        String line = String.format("[%s] %s %s: %s%n",
                LocalDateTime.now(clock).format(TIMESTAMP), level, base, message);
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append to {}: {}", file, line.strip(), e);
        }
    }
}

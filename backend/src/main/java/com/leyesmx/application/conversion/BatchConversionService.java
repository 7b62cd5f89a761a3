package com.leyesmx.application.conversion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.infrastructure.parsing.pipeline.StatuteParsingPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Converts every cleaned statute text of a directory into the output tree:
 * <pre>
 * &lt;output&gt;/json/&lt;base&gt;.json   one file per accepted document
 * &lt;output&gt;/logs.txt            append-only conversion log
 * &lt;output&gt;/index.json          manifest of the run
 * </pre>
 * A failing document never aborts the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchConversionService {

    static final String JSON_DIR = "json";
    static final String LOG_FILE = "logs.txt";
    static final String INDEX_FILE = "index.json";

    private static final Set<ParseIssueType> ADVISORY_TYPES = Set.of(
            ParseIssueType.EMPTY_DECREE,
            ParseIssueType.EMPTY_TITLE,
            ParseIssueType.NO_TRANSITORIES,
            ParseIssueType.EMPTY_NORMATIVE_BODY
    );

    private final StatuteParsingPipeline parsingPipeline;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BatchSettings settings;

    public BatchReport convertDirectory(Path inputDir, Path outputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new StatuteConversionException("Input directory does not exist: " + inputDir);
        }
        Path jsonDir = outputDir.resolve(JSON_DIR);
        try {
            Files.createDirectories(jsonDir);
        } catch (IOException e) {
            throw new StatuteConversionException("Cannot create output directory " + jsonDir, e);
        }

        List<Path> files = listInputs(inputDir);
        log.info("Converting {} files from {} into {} (parallelism={})",
                files.size(), inputDir, outputDir, settings.parallelism());

        // Files sharing a base id write the same JSON; one worker takes them in name order
        Map<String, List<Path>> byBase = files.stream()
                .collect(Collectors.groupingBy(DocumentIds::baseId, LinkedHashMap::new, Collectors.toList()));

        ConversionLog conversionLog = new ConversionLog(outputDir.resolve(LOG_FILE), clock);
        ExecutorService executor = Executors.newFixedThreadPool(settings.parallelism());
        List<DocumentOutcome> outcomes;
        try {
            List<CompletableFuture<List<DocumentOutcome>>> futures = byBase.values().stream()
                    .map(group -> CompletableFuture.supplyAsync(
                            () -> convertGroup(group, jsonDir, conversionLog), executor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            outcomes = futures.stream()
                    .flatMap(future -> future.join().stream())
                    .toList();
        } finally {
            executor.shutdown();
        }

        BatchReport report = new BatchReport(inputDir.toString(), outputDir.toString(), outcomes);
        writeIndex(outputDir.resolve(INDEX_FILE), report);

        log.info("Batch finished: {} written, {} rejected, {} failed",
                report.count(ConversionStatus.WRITTEN),
                report.count(ConversionStatus.REJECTED),
                report.count(ConversionStatus.FAILED));
        return report;
    }

    /**
     * Convert files sharing one base id, in name order. Each later file overwrites the
     * JSON of the earlier ones and carries a DUPLICATE_BASE_ID warning.
     */
    List<DocumentOutcome> convertGroup(List<Path> group, Path jsonDir, ConversionLog conversionLog) {
        List<DocumentOutcome> outcomes = new ArrayList<>(group.size());
        String first = group.get(0).getFileName().toString();
        for (Path file : group) {
            DocumentOutcome outcome = convertFile(file, jsonDir, conversionLog);
            if (!outcomes.isEmpty()) {
                log.warn("{} shares base id {} with {}", file.getFileName(), outcome.base(), first);
                conversionLog.warn(outcome.base(), "base duplicada - " + outcome.sourceFile()
                        + " reemplaza la salida de " + first);
                outcome = outcome.withIssue(ParseIssue.warning(ParseIssueType.DUPLICATE_BASE_ID,
                        "Base id " + outcome.base() + " is shared with " + first + "; the later file wins",
                        outcome.sourceFile()));
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    /**
     * Convert one source file. Every failure is turned into a FAILED outcome.
     */
    DocumentOutcome convertFile(Path file, Path jsonDir, ConversionLog conversionLog) {
        String base = DocumentIds.baseId(file);
        String sourceFile = file.getFileName().toString();
        conversionLog.inicio(base, "iniciando procesamiento");

        try {
            String text = readText(file);
            ParseResult result = parsingPipeline.parse(base, text);
            logIssues(base, result, conversionLog);

            if (!result.accepted()) {
                conversionLog.error(base, "documento rechazado - " + summarize(result.errors()));
                return new DocumentOutcome(base, sourceFile, ConversionStatus.REJECTED, null,
                        0, 0, 0, result.issues());
            }

            StatuteDocument document = result.document();
            Path output = jsonDir.resolve(base + ".json");
            writeJson(output, Map.of(result.outputKey(), document));
            conversionLog.success(base, "JSON generado exitosamente - "
                    + document.articleCount() + " artículos permanentes");
            return new DocumentOutcome(base, sourceFile, ConversionStatus.WRITTEN,
                    JSON_DIR + "/" + output.getFileName(),
                    document.capitulos().size(), document.articleCount(), document.transitoryArticleCount(),
                    result.issues());
        } catch (StatuteConversionException | IOException e) {
            log.error("Conversion of {} failed", file, e);
            conversionLog.error(base, "fallo de conversión (" + e.getMessage() + ")");
            return DocumentOutcome.failed(base, sourceFile,
                    ParseIssue.error(ParseIssueType.STRUCTURAL_FAILURE, "Conversion failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error while parsing {}", file, e);
            conversionLog.error(base, "error inesperado (" + e + ")");
            return DocumentOutcome.failed(base, sourceFile,
                    ParseIssue.error(ParseIssueType.STRUCTURAL_FAILURE, "Unexpected error: " + e));
        }
    }

    /**
     * UTF-8, falling back to ISO-8859-1 when the bytes are not valid UTF-8.
     */
    String readText(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, reading it as ISO-8859-1", file.getFileName());
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private List<Path> listInputs(Path inputDir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, settings.fileGlob())) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new StatuteConversionException("Cannot list " + inputDir, e);
        }
        files.sort(Path::compareTo);
        return files;
    }

    private void logIssues(String base, ParseResult result, ConversionLog conversionLog) {
        for (ParseIssue issue : result.warnings()) {
            if (ADVISORY_TYPES.contains(issue.type())) {
                conversionLog.info(base, advisoryMessage(issue));
            } else {
                conversionLog.warn(base, issue.type() + " - " + issue.message());
            }
        }
    }

    private static String advisoryMessage(ParseIssue issue) {
        return switch (issue.type()) {
            case EMPTY_DECREE -> "sin Decreto";
            case EMPTY_TITLE -> "sin Título";
            case NO_TRANSITORIES -> "sin Transitorios";
            case EMPTY_NORMATIVE_BODY -> "sin cuerpo normativo";
            default -> issue.message();
        };
    }

    private static String summarize(List<ParseIssue> errors) {
        return String.join("; ", errors.stream().map(i -> i.type() + ": " + i.message()).toList());
    }

    private void writeJson(Path output, Object value) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), value);
        } catch (IOException e) {
            throw new StatuteConversionException("Failed to write " + output, e);
        }
    }

    private void writeIndex(Path index, BatchReport report) {
        writeJson(index, report);
        log.debug("Wrote manifest {}", index);
    }
}

package com.leyesmx.application.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.leyesmx.infrastructure.parsing.ParsingFixtures.FIXED_CLOCK;
import static com.leyesmx.infrastructure.parsing.ParsingFixtures.pipeline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchConversionServiceTest {

    private static final String VALID = "DECRETO por el que se expide la Ley de Prueba.\n"
            + "Artículo 1. Texto.\nTRANSITORIOS\nÚnico. Vigencia.";

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;
    private ObjectMapper objectMapper;
    private BatchConversionService service;

    @BeforeEach
    void setUp() throws Exception {
        input = Files.createDirectories(tempDir.resolve("Clean"));
        output = tempDir.resolve("Refined");
        objectMapper = new ObjectMapper();
        service = new BatchConversionService(pipeline(), objectMapper, FIXED_CLOCK,
                new BatchSettings("", "Refined", "*.txt", 2));
    }

    @Test
    @DisplayName("escribe JSON, bitácora e índice para un lote mixto")
    void lote_mixto() throws Exception {
        Files.writeString(input.resolve("clean_0008.txt"), VALID);
        Files.writeString(input.resolve("clean_0009.txt"), "Aviso sin artículos.");
        Files.writeString(input.resolve("notas.md"), "ignorado");

        BatchReport report = service.convertDirectory(input, output);

        assertThat(report.documents()).extracting(DocumentOutcome::base).containsExactly("0008", "0009");
        assertThat(report.count(ConversionStatus.WRITTEN)).isEqualTo(1);
        assertThat(report.count(ConversionStatus.REJECTED)).isEqualTo(1);

        Path json = output.resolve("json").resolve("0008.json");
        assertThat(json).exists();
        assertThat(output.resolve("json").resolve("0009.json")).doesNotExist();

        JsonNode root = objectMapper.readTree(json.toFile());
        assertThat(root.has("0008.JSON")).isTrue();
        assertThat(root.get("0008.JSON").get("Título").asText()).isEqualTo("Ley de Prueba");

        List<String> log = Files.readAllLines(output.resolve("logs.txt"), StandardCharsets.UTF_8);
        assertThat(log).anyMatch(line -> line.matches("\\[2026-03-01 \\d{2}:\\d{2}:\\d{2}] INICIO 0008: .*"));
        assertThat(log).anyMatch(line -> line.contains("SUCCESS 0008: JSON generado exitosamente - 1 artículos permanentes"));
        assertThat(log).anyMatch(line -> line.contains("ERROR 0009:"));

        JsonNode index = objectMapper.readTree(output.resolve("index.json").toFile());
        assertThat(index.get("documents")).hasSize(2);
        assertThat(index.get("documents").get(0).get("status").asText()).isEqualTo("WRITTEN");
        assertThat(index.get("documents").get(0).get("outputFile").asText()).isEqualTo("json/0008.json");
        assertThat(index.get("documents").get(1).get("issues").get(0).get("type").asText()).isNotBlank();
    }

    @Test
    @DisplayName("los huecos de metadatos se registran como INFO")
    void huecos_en_bitacora() throws Exception {
        Files.writeString(input.resolve("clean_0100.txt"), "Artículo 1. Texto.");

        service.convertDirectory(input, output);

        List<String> log = Files.readAllLines(output.resolve("logs.txt"), StandardCharsets.UTF_8);
        assertThat(log).anyMatch(line -> line.contains("INFO 0100: sin Decreto"));
        assertThat(log).anyMatch(line -> line.contains("INFO 0100: sin Transitorios"));
    }

    @Test
    @DisplayName("lee archivos ISO-8859-1 cuando no son UTF-8 válido")
    void latin1() throws Exception {
        Files.write(input.resolve("clean_0200.txt"),
                "Artículo 1. Disposición única.".getBytes(StandardCharsets.ISO_8859_1));

        BatchReport report = service.convertDirectory(input, output);

        assertThat(report.documents().get(0).status()).isEqualTo(ConversionStatus.WRITTEN);
        JsonNode article = objectMapper.readTree(output.resolve("json/0200.json").toFile())
                .get("0200.JSON").get("Capítulos").get(0).get("Artículos").get(0);
        assertThat(article.get("Texto").asText()).isEqualTo("Disposición única.");
    }

    @Test
    @DisplayName("si la bitácora no se puede escribir el lote termina y escribe el índice")
    void bitacora_no_escribible() throws Exception {
        Files.writeString(input.resolve("clean_0300.txt"), VALID);
        Files.createDirectories(output.resolve("logs.txt"));

        BatchReport report = service.convertDirectory(input, output);

        assertThat(report.documents()).singleElement()
                .satisfies(outcome -> assertThat(outcome.status()).isEqualTo(ConversionStatus.WRITTEN));
        assertThat(output.resolve("json/0300.json")).exists();
        assertThat(output.resolve("index.json")).exists();
    }

    @Test
    @DisplayName("archivos con la misma base se convierten en orden y el último gana")
    void base_duplicada() throws Exception {
        Files.writeString(input.resolve("0008_v2.txt"), VALID.replace("Ley de Prueba", "Ley Reformada"));
        Files.writeString(input.resolve("clean_0008.txt"), VALID);

        BatchReport report = service.convertDirectory(input, output);

        assertThat(report.documents()).extracting(DocumentOutcome::sourceFile)
                .containsExactly("0008_v2.txt", "clean_0008.txt");
        assertThat(report.documents().get(0).issues()).extracting(ParseIssue::type)
                .doesNotContain(ParseIssueType.DUPLICATE_BASE_ID);
        assertThat(report.documents().get(1).issues()).extracting(ParseIssue::type)
                .contains(ParseIssueType.DUPLICATE_BASE_ID);

        JsonNode root = objectMapper.readTree(output.resolve("json/0008.json").toFile());
        assertThat(root.get("0008.JSON").get("Título").asText()).isEqualTo("Ley de Prueba");

        List<String> log = Files.readAllLines(output.resolve("logs.txt"), StandardCharsets.UTF_8);
        assertThat(log).anyMatch(line -> line.contains("WARN 0008: base duplicada - clean_0008.txt"));
    }

    @Test
    @DisplayName("directorio de entrada inexistente")
    void sin_entrada() {
        assertThatThrownBy(() -> service.convertDirectory(tempDir.resolve("missing"), output))
                .isInstanceOf(StatuteConversionException.class);
    }
}

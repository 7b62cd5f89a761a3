package com.leyesmx.infrastructure.parsing.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.Fraction;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.domain.statute.model.TransitoryArticle;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.leyesmx.infrastructure.parsing.ParsingFixtures.pipeline;
import static com.leyesmx.infrastructure.parsing.ParsingFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;

class StatuteParsingPipelineTest {

    private static final String LEY = """
            DECRETO por el que se expide la Ley Federal de Ejemplo.
            Publicado en el Diario Oficial de la Federación el 15 de mayo de 2003.

            LEY FEDERAL DE EJEMPLO

            CAPÍTULO I
            DISPOSICIONES GENERALES

            Artículo 1o.- Esta Ley es de orden público.

            Artículo 2.- Para efectos de esta Ley se entiende por:
            I. Autoridad: la dependencia competente;
            II. Ley: la presente Ley, y
            III. Reglamento: el reglamento de esta Ley.

            CAPÍTULO II
            DE LAS OBLIGACIONES

            Artículo 3.- Son obligaciones de los sujetos: I. Registrarse; II. Informar.

            Artículo 3 Bis.- Las obligaciones se cumplirán en los plazos que fije la autoridad.

            TRANSITORIOS

            PRIMERO.- La presente Ley entrará en vigor al día siguiente de su publicación.

            SEGUNDO.- Se derogan las disposiciones que se opongan a la presente Ley.
            """;

    private StatuteParsingPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = pipeline();
    }

    @Nested
    @DisplayName("Escenarios básicos")
    class Escenarios {

        @Test
        @DisplayName("A: un artículo con dos fracciones en una sola línea")
        void escenario_a() {
            ParseResult result = pipeline.parse("0001", "Artículo 1. Texto base. I. Primera. II. Segunda.");

            assertThat(result.accepted()).isTrue();
            assertThat(result.document().capitulos()).containsExactly(new Chapter(Chapter.FALLBACK_LABEL, List.of(
                    new Article(1, "Texto base.", List.of(
                            new Fraction("I", "Primera."),
                            new Fraction("II", "Segunda."))))));
        }

        @Test
        @DisplayName("B: dos capítulos en orden, un artículo cada uno")
        void escenario_b() {
            ParseResult result = pipeline.parse("0002",
                    "CAPÍTULO I DISPOSICIONES\nArtículo 1...\nCAPÍTULO II OTRO\nArtículo 2...");

            List<Chapter> chapters = result.document().capitulos();
            assertThat(chapters).extracting(Chapter::label).containsExactly("CAPÍTULO I DISPOSICIONES", "CAPÍTULO II OTRO");
            assertThat(chapters).extracting(c -> c.articulos().get(0).numero()).containsExactly(1, 2);
        }

        @Test
        @DisplayName("C: Artículo 5 y 5 Bis son hermanos con número 5")
        void escenario_c() {
            ParseResult result = pipeline.parse("0003", "Artículo 5. Texto Y.\nArtículo 5 Bis. Texto X.");

            assertThat(result.document().capitulos().get(0).articulos()).containsExactly(
                    new Article(5, "Texto Y.", List.of()),
                    new Article(5, "Texto X.", List.of()));
        }

        @Test
        @DisplayName("D: bloque transitorio con artículo Único")
        void escenario_d() {
            ParseResult result = pipeline.parse("0004", "Artículo 1. Texto.\nTRANSITORIOS\nÚnico. Vigencia...");

            assertThat(result.document().transitorios()).singleElement().satisfies(chapter -> {
                assertThat(chapter.label()).isEqualTo("Capítulo Único");
                assertThat(chapter.articulos()).containsExactly(new TransitoryArticle("Único", "Vigencia...", List.of()));
            });
        }

        @Test
        @DisplayName("E: sin artículos no hay documento y sí fallo estructural")
        void escenario_e() {
            ParseResult result = pipeline.parse("0005", "Un aviso sin ninguna estructura legal.");

            assertThat(result.accepted()).isFalse();
            assertThat(result.documentIfAccepted()).isEmpty();
            assertThat(result.errors()).extracting(ParseIssue::type).contains(ParseIssueType.STRUCTURAL_FAILURE);
        }

        @Test
        @DisplayName("texto vacío o nulo se rechaza sin excepción")
        void vacio() {
            assertThat(pipeline.parse("0006", "").accepted()).isFalse();
            assertThat(pipeline.parse("0006", null).accepted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Documento completo")
    class DocumentoCompleto {

        @Test
        @DisplayName("metadatos, capítulos, artículos y transitorios")
        void documento() {
            ParseResult result = pipeline.parse("0008", LEY);
            StatuteDocument document = result.document();

            assertThat(result.errors()).isEmpty();
            assertThat(document.titulo()).isEqualTo("LEY FEDERAL DE EJEMPLO");
            assertThat(document.anioPublicacion()).isEqualTo(2003);
            assertThat(document.decreto()).startsWith("DECRETO por el que se expide").endsWith("LEY FEDERAL DE EJEMPLO");
            assertThat(document.capitulos()).extracting(Chapter::label)
                    .containsExactly("CAPÍTULO I DISPOSICIONES GENERALES", "CAPÍTULO II DE LAS OBLIGACIONES");
            assertThat(document.articleCount()).isEqualTo(4);

            Article second = document.capitulos().get(0).articulos().get(1);
            assertThat(second.texto()).isEqualTo("Para efectos de esta Ley se entiende por:");
            assertThat(second.fracciones()).extracting(Fraction::label).containsExactly("I", "II", "III");

            Article third = document.capitulos().get(1).articulos().get(0);
            assertThat(third.fracciones()).containsExactly(
                    new Fraction("I", "Registrarse;"), new Fraction("II", "Informar."));

            assertThat(document.transitorios().get(0).articulos()).extracting(TransitoryArticle::ordinal)
                    .containsExactly("Primero", "Segundo");
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("reconstrucción: los textos cubren la Norma salvo los encabezados")
        void reconstruccion() {
            StatuteDocument document = pipeline.parse("0008", LEY).document();
            TextNormalizer normalizer = new TextNormalizer();

            StringBuilder rebuilt = new StringBuilder();
            for (Chapter chapter : document.capitulos()) {
                for (Article article : chapter.articulos()) {
                    rebuilt.append(article.texto()).append(' ');
                    article.fracciones().forEach(f -> rebuilt.append(f.texto()).append(' '));
                }
            }

            String norma = LEY.substring(LEY.indexOf("CAPÍTULO I\n"), LEY.indexOf("TRANSITORIOS"));
            String withoutHeaders = norma
                    .replaceAll("(?m)^CAPÍTULO I+\\n[^\\n]+$", " ")
                    .replaceAll("(?m)^Artículo \\d+(o| Bis)?\\.- ", " ")
                    .replaceAll("(?m)^I+\\. ", " ")
                    .replaceAll("(?<=[;:]) I+\\. ", " ");

            assertThat(normalizer.collapseWhitespace(rebuilt.toString()))
                    .isEqualTo(normalizer.collapseWhitespace(withoutHeaders));
        }

        @Test
        @DisplayName("idempotencia: los textos extraídos no contienen más estructura")
        void idempotencia() {
            StatuteDocument document = pipeline.parse("0008", LEY).document();
            MarkerScanner scanner = new MarkerScanner(new TextNormalizer());

            for (Chapter chapter : document.capitulos()) {
                for (Article article : chapter.articulos()) {
                    List<String> texts = new java.util.ArrayList<>();
                    texts.add(article.texto());
                    article.fracciones().forEach(f -> texts.add(f.texto()));
                    for (String text : texts) {
                        SourceText src = source(text);
                        assertThat(scanner.articleHeaders(src, 0, src.length())).isEmpty();
                        assertThat(scanner.fractionMarkers(src, 0, src.length())).isEmpty();
                    }
                }
            }
        }

        @Test
        @DisplayName("serializa con las claves y el orden del formato de salida")
        void serializacion() throws Exception {
            ParseResult result = pipeline.parse("0008", LEY);
            ObjectMapper mapper = new ObjectMapper();

            String json = mapper.writeValueAsString(Map.of(result.outputKey(), result.document()));
            JsonNode root = mapper.readTree(json).get("0008.JSON");

            assertThat(root.fieldNames()).toIterable()
                    .containsExactly("Decreto", "Año_publicación", "Título", "Capítulos", "Transitorios");
            JsonNode article = root.get("Capítulos").get(0).get("Artículos").get(0);
            assertThat(article.fieldNames()).toIterable().containsExactly("Artículo", "Texto", "Fracciones");
            assertThat(article.get("Artículo").isInt()).isTrue();
            assertThat(root.get("Transitorios").get(0).get("Artículos").get(0).get("Artículo").asText()).isEqualTo("Primero");
            assertThat(json).contains("Capítulo").doesNotContain("\\u00ed");
        }

        @Test
        @DisplayName("año nulo se serializa explícitamente")
        void anio_nulo() throws Exception {
            StatuteDocument document = pipeline.parse("0009", "Artículo 1. Texto.").document();
            JsonNode node = new ObjectMapper().valueToTree(document);
            assertThat(node.has("Año_publicación")).isTrue();
            assertThat(node.get("Año_publicación").isNull()).isTrue();
        }
    }
}

package com.leyesmx.infrastructure.parsing.structure;

import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.ArticleKey;
import com.leyesmx.domain.statute.model.Fraction;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.leyesmx.infrastructure.parsing.ParsingFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;

class ArticleExtractorTest {

    private MarkerScanner scanner;
    private ArticleExtractor extractor;
    private List<ParseIssue> issues;

    @BeforeEach
    void setUp() {
        TextNormalizer normalizer = new TextNormalizer();
        scanner = new MarkerScanner(normalizer);
        extractor = new ArticleExtractor(scanner, new FractionExtractor(scanner, normalizer), normalizer);
        issues = new ArrayList<>();
    }

    private List<ExtractedArticle> extract(String text) {
        SourceText src = source(text);
        return extractor.extract(src, 0, src.length(), List.of(), new ArticleKeys(), issues::add);
    }

    private static List<Article> articles(List<ExtractedArticle> extracted) {
        return extracted.stream().map(ExtractedArticle::article).toList();
    }

    @Nested
    @DisplayName("Sufijos")
    class Sufijos {

        @Test
        @DisplayName("Artículo 5 y Artículo 5 Bis son hermanos con el mismo número")
        void bis_hermano() {
            List<ExtractedArticle> extracted = extract("Artículo 5. Texto Y.\nArtículo 5 Bis. Texto X.");

            assertThat(articles(extracted)).containsExactly(
                    new Article(5, "Texto Y.", List.of()),
                    new Article(5, "Texto X.", List.of()));
            assertThat(extracted).extracting(ExtractedArticle::key).containsExactly(
                    new ArticleKey(5, "", 0), new ArticleKey(5, "BIS", 0));
            assertThat(issues).isEmpty();
        }

        @Test
        @DisplayName("un encabezado repetido sin contenido intermedio se fusiona")
        void repetido_adyacente() {
            List<ExtractedArticle> extracted = extract("Artículo 3.\n\nArtículo 3. Texto único.");
            assertThat(articles(extracted)).containsExactly(new Article(3, "Texto único.", List.of()));
            assertThat(issues).isEmpty();
        }

        @Test
        @DisplayName("un encabezado repetido más adelante es un duplicado")
        void repetido_no_adyacente() {
            List<ExtractedArticle> extracted = extract("Artículo 1. Uno.\nArtículo 2. Dos.\nArtículo 1. Otra vez.");

            assertThat(articles(extracted)).extracting(Article::numero).containsExactly(1, 2, 1);
            assertThat(extracted.get(2).key().occurrence()).isEqualTo(1);
            assertThat(issues).extracting(ParseIssue::type).containsExactlyInAnyOrder(
                    ParseIssueType.DUPLICATE_ARTICLE, ParseIssueType.ARTICLE_SEQUENCE);
        }
    }

    @Nested
    @DisplayName("Cuerpos")
    class Cuerpos {

        @Test
        @DisplayName("artículo sin texto se conserva con texto vacío")
        void sin_texto() {
            List<ExtractedArticle> extracted = extract("Artículo 1.\nArtículo 2. Dos.");
            assertThat(articles(extracted)).containsExactly(
                    new Article(1, "", List.of()),
                    new Article(2, "Dos.", List.of()));
        }

        @Test
        @DisplayName("una referencia a otro artículo partida al inicio de línea queda en el texto")
        void referencia_partida() {
            List<ExtractedArticle> extracted = extract(
                    "Artículo 4. Lo previsto en el\nartículo 5 de esta Ley se aplica.\nArtículo 5. Texto cinco.");

            assertThat(articles(extracted)).containsExactly(
                    new Article(4, "Lo previsto en el artículo 5 de esta Ley se aplica.", List.of()),
                    new Article(5, "Texto cinco.", List.of()));
            assertThat(issues).isEmpty();
        }

        @Test
        @DisplayName("fracciones en línea separadas por comas")
        void fracciones_con_comas() {
            List<ExtractedArticle> extracted = extract("Artículo 1. Son: I) uno, II) dos.");
            assertThat(extracted.get(0).article()).isEqualTo(new Article(1, "Son:",
                    List.of(new Fraction("I", "uno,"), new Fraction("II", "dos."))));
        }

        @Test
        @DisplayName("las fracciones se extraen de cada cuerpo")
        void con_fracciones() {
            List<ExtractedArticle> extracted = extract("Artículo 1. Texto base. I. Primera. II. Segunda.");
            Article article = extracted.get(0).article();
            assertThat(article.texto()).isEqualTo("Texto base.");
            assertThat(article.fracciones()).hasSize(2);
        }

        @Test
        @DisplayName("un corte termina el artículo y el texto huérfano se reporta")
        void corte_y_huerfano() {
            String text = "Artículo 1. Uno.\nSECCIÓN PRIMERA De las cosas\nTexto suelto.\nArtículo 2. Dos.";
            SourceText src = source(text);
            List<Marker> cuts = scanner.levelHeaders(src, 0, src.length());

            List<ExtractedArticle> extracted = extractor.extract(src, 0, src.length(), cuts, new ArticleKeys(), issues::add);

            assertThat(articles(extracted)).extracting(Article::texto).containsExactly("Uno.", "Dos.");
            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.type()).isEqualTo(ParseIssueType.ORPHAN_TEXT);
                assertThat(issue.matchedText()).isEqualTo("Texto suelto.");
            });
        }
    }
}

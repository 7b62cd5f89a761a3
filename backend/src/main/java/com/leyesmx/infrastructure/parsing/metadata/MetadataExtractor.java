package com.leyesmx.infrastructure.parsing.metadata;

import com.leyesmx.domain.statute.model.DocumentMetadata;
import com.leyesmx.domain.statute.model.DocumentSegments;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.pattern.MarkerScanner;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers Título and Año_publicación from the decree preamble and the opening of the
 * normative body. Heuristics run in a fixed order and the first one that fires wins.
 * Read-only: the scanned spans stay where they are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetadataExtractor {

    private final TextNormalizer textNormalizer;
    private final MarkerScanner markerScanner;
    private final Clock clock;

    // Lines of the normative body considered for the title
    private static final int TITLE_NORMA_LINES = 10;

    // Characters of the normative body scanned for the year
    private static final int YEAR_NORMA_CHARS = 3000;

    // How far after a publication phrase a year may appear
    private static final int PUBLICATION_WINDOW = 160;

    private static final int MIN_TITLE_LETTERS = 10;

    // ── Title patterns (folded text) ──

    private static final Pattern STATUTE_KEYWORD = Pattern.compile(
            "^(?:LEY|CODIGO|CONSTITUCION|REGLAMENTO|ESTATUTO|PRESUPUESTO|ORDENANZA)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ENACTED_OBJECT = Pattern.compile(
            "\\bSE\\s+EXPIDE(?:N)?\\s+(?:LA|EL|LAS|LOS)\\s+(?<object>[^.,;]+)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern DECREE_LINE = Pattern.compile("^DECRETO\\b", Pattern.CASE_INSENSITIVE);

    // ── Year patterns (normalized upper-case text) ──

    private static final Pattern PUBLICATION_PHRASE = Pattern.compile(
            "PUBLICAD[AO]S?|PUBLICACION|DIARIO OFICIAL|\\bDOF\\b|PERIODICO OFICIAL"
    );

    private static final Pattern DOF_STAMP = Pattern.compile(
            "\\bDOF\\s*:?\\s*\\d{1,2}[-/]\\d{1,2}[-/](?<year>\\d{4})(?!\\d)"
    );

    private static final Pattern LONG_DATE = Pattern.compile(
            "\\b\\d{1,2}\\s*(?:O|\\u00BA)?\\s+DE\\s+" +
                    "(?:ENERO|FEBRERO|MARZO|ABRIL|MAYO|JUNIO|JULIO|AGOSTO|SEPTIEMBRE|SETIEMBRE|OCTUBRE|NOVIEMBRE|DICIEMBRE)" +
                    "\\s+(?:DE|DEL(?:\\s+ANO)?)\\s+(?<year>\\d{4})(?!\\d)"
    );

    private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)(?<year>\\d{4})(?!\\d)");

    public DocumentMetadata extract(SourceText source, DocumentSegments segments) {
        String titulo = extractTitle(source, segments);
        Integer anio = extractYear(source, segments);
        log.debug("Metadata: titulo=\"{}\", anio={}", titulo, anio);
        return new DocumentMetadata(titulo, anio);
    }

    // ===== Título =====

    String extractTitle(SourceText source, DocumentSegments segments) {
        List<String> lines = candidateLines(source, segments);

        List<Function<List<String>, Optional<String>>> heuristics = List.of(
                this::allCapsStatuteLine,
                this::anyCaseStatuteLine,
                this::enactedObject,
                this::firstAllCapsLine
        );
        for (Function<List<String>, Optional<String>> heuristic : heuristics) {
            Optional<String> title = heuristic.apply(lines);
            if (title.isPresent()) {
                return stripTrailingPeriod(title.get());
            }
        }
        return "";
    }

    private Optional<String> allCapsStatuteLine(List<String> lines) {
        return lines.stream()
                .filter(line -> isAllCaps(line) && STATUTE_KEYWORD.matcher(textNormalizer.fold(line)).find())
                .findFirst();
    }

    private Optional<String> anyCaseStatuteLine(List<String> lines) {
        return lines.stream()
                .filter(line -> line.length() >= MIN_TITLE_LETTERS
                        && STATUTE_KEYWORD.matcher(textNormalizer.fold(line)).find())
                .findFirst();
    }

    private Optional<String> enactedObject(List<String> lines) {
        for (String line : lines) {
            // fold is length-preserving, so the group offsets index the original line
            Matcher m = ENACTED_OBJECT.matcher(textNormalizer.fold(line));
            if (m.find()) {
                return Optional.of(line.substring(m.start("object"), m.end("object")).strip());
            }
        }
        return Optional.empty();
    }

    private Optional<String> firstAllCapsLine(List<String> lines) {
        return lines.stream()
                .filter(line -> isAllCaps(line)
                        && letterCount(line) >= MIN_TITLE_LETTERS
                        && !DECREE_LINE.matcher(textNormalizer.fold(line)).find())
                .findFirst();
    }

    /**
     * Non-blank lines of Decreto followed by the first lines of Norma, headers excluded,
     * each with whitespace collapsed.
     */
    private List<String> candidateLines(SourceText source, DocumentSegments segments) {
        List<String> lines = new ArrayList<>();
        collectLines(source, 0, segments.normaStart(), Integer.MAX_VALUE, lines);
        collectLines(source, segments.normaStart(), segments.transStart(), TITLE_NORMA_LINES, lines);
        return lines;
    }

    private void collectLines(SourceText source, int from, int to, int maxLines, List<String> out) {
        int lineStart = from;
        int taken = 0;
        while (lineStart < to && taken < maxLines) {
            int lineEnd = source.folded().indexOf('\n', lineStart);
            if (lineEnd < 0 || lineEnd > to) {
                lineEnd = to;
            }
            if (!source.isBlank(lineStart, lineEnd)) {
                taken++;
                if (!markerScanner.isHeaderLine(source, lineStart, lineEnd)) {
                    out.add(textNormalizer.collapseWhitespace(source.slice(lineStart, lineEnd)));
                }
            }
            lineStart = lineEnd + 1;
        }
    }

    private static boolean isAllCaps(String line) {
        return letterCount(line) > 0 && line.equals(line.toUpperCase(Locale.ROOT));
    }

    private static int letterCount(String line) {
        return (int) line.chars().filter(Character::isLetter).count();
    }

    private static String stripTrailingPeriod(String title) {
        String result = title.strip();
        while (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1).strip();
        }
        return result;
    }

    // ===== Año_publicación =====

    Integer extractYear(SourceText source, DocumentSegments segments) {
        int normaEnd = Math.min(segments.transStart(), segments.normaStart() + YEAR_NORMA_CHARS);
        String scope = textNormalizer.normalize(source.slice(0, normaEnd));
        if (scope == null || scope.isEmpty()) {
            return null;
        }
        scope = scope.toUpperCase(Locale.ROOT);
        int maxYear = Year.now(clock).getValue();

        Integer year = yearNearPublicationPhrase(scope, maxYear);
        if (year == null) {
            year = firstYear(DOF_STAMP, scope, maxYear);
        }
        if (year == null) {
            year = firstYear(LONG_DATE, scope, maxYear);
        }
        if (year == null) {
            year = firstYear(YEAR_TOKEN, scope, maxYear);
        }
        return year;
    }

    private static Integer yearNearPublicationPhrase(String scope, int maxYear) {
        Matcher phrase = PUBLICATION_PHRASE.matcher(scope);
        while (phrase.find()) {
            Matcher year = YEAR_TOKEN.matcher(scope);
            year.region(phrase.end(), Math.min(scope.length(), phrase.end() + PUBLICATION_WINDOW));
            while (year.find()) {
                int value = Integer.parseInt(year.group("year"));
                if (inRange(value, maxYear)) {
                    return value;
                }
            }
        }
        return null;
    }

    private static Integer firstYear(Pattern pattern, String scope, int maxYear) {
        Matcher m = pattern.matcher(scope);
        while (m.find()) {
            int value = Integer.parseInt(m.group("year"));
            if (inRange(value, maxYear)) {
                return value;
            }
        }
        return null;
    }

    private static boolean inRange(int year, int maxYear) {
        return year >= DocumentMetadata.MIN_YEAR && year <= maxYear;
    }
}

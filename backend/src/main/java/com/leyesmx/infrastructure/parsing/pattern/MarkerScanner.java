package com.leyesmx.infrastructure.parsing.pattern;

import com.leyesmx.domain.statute.model.HierarchyLevel;
import com.leyesmx.domain.statute.model.Marker;
import com.leyesmx.domain.statute.model.SourceText;
import com.leyesmx.infrastructure.parsing.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the structural markers of a statute: level headers, article headers,
 * fraction markers, transitory headers and transitory article headers.
 * <p>
 * Every pattern runs on the folded (accent-free) view of {@link SourceText}; the
 * reported offsets are valid in the original text because folding preserves length.
 * Line-anchored patterns only match at real line starts, never at a region boundary
 * that falls mid-line.
 */
@Component
@RequiredArgsConstructor
public class MarkerScanner {

    private final TextNormalizer textNormalizer;

    // Level heading lines longer than this are prose that happens to start with a keyword
    private static final int MAX_HEADING_LINE = 180;

    // A bare "CAPÍTULO I" may take its name from the following line, if it is short
    private static final int MAX_HEADING_TITLE_LINE = 150;

    // ── Ordinal vocabularies (folded, upper-case) ──

    private static final String UNIT_ORDINALS =
            "PRIMER[OA]?|SEGUND[OA]|TERCER[OA]?|CUART[OA]|QUINT[OA]|SEXT[OA]|" +
            "SEPTIM[OA]|SETIM[OA]|OCTAV[OA]|NOVEN[OA]";

    private static final String TENS_ORDINALS =
            "UNDECIM[OA]|DUODECIM[OA]|DECIM[OA]|VIGESIM[OA]|TRIGESIM[OA]|" +
            "CUADRAGESIM[OA]|QUINCUAGESIM[OA]";

    private static final String ORDINAL_WORD =
            "(?:(?:" + TENS_ORDINALS + ")(?:[ \\t]*(?:" + UNIT_ORDINALS + "))?|" +
            UNIT_ORDINALS + "|UNIC[OA])";

    private static final String ARTICLE_SUFFIXES =
            "BIS|TER|QUATER|QUINQUIES|SEXIES|SEPTIES|OCTIES|NONIES";

    private static final String DASHES = "\\-\\u2013\\u2014";

    // ── Patterns ──

    // Roman ordinals are upper-case only; ordinal words in any case
    private static final String LEVEL_ORDINAL =
            "(?:[IVXLCDM]+|\\d+|(?i:" + ORDINAL_WORD + "|PRELIMINAR))(?![A-Za-z0-9])";

    // Keywords are "CAPÍTULO" or "Capítulo"; a lower-case "capítulo" is a cross-reference
    private static final Pattern LEVEL_HEADER = Pattern.compile(
            "^[ \\t]*(?:(?<libro>" + keyword("LIBRO") + ")|(?<titulo>" + keyword("TITULO") + ")|" +
                    "(?<capitulo>" + keyword("CAPITULO") + ")|(?<seccion>" + keyword("SECCION") + "))" +
                    "[ \\t]+(?<ordinal>" + LEVEL_ORDINAL + ")" +
                    "(?<rest>[^\\n]*)",
            Pattern.MULTILINE
    );

    private static final Pattern ARTICLE_HEADER = Pattern.compile(
            "^[ \\t]*(?:ARTICULO|Articulo|ART\\.|Art\\.)[ \\t]*(?<number>\\d+)(?:o(?![A-Za-z0-9])|\\u00BA|\\u00B0)?" +
                    "(?:[ \\t]*[" + DASHES + "]?[ \\t]*(?<suffix>(?i:" + ARTICLE_SUFFIXES + "))(?![A-Za-z])" +
                    "|[ \\t]*[" + DASHES + "]?[ \\t]*(?<letter>[A-Z])(?=[ \\t]*(?:[.:)" + DASHES + "]|$)))?" +
                    "(?![0-9])[ \\t]*[.:]?[ \\t]*[" + DASHES + "]*[ \\t]*",
            Pattern.MULTILINE
    );

    // Case-sensitive: fraction numerals are upper-case; I..LXXXIX.
    // Inline markers follow punctuation or the conjunction "y"
    private static final Pattern FRACTION_MARKER = Pattern.compile(
            "(?:^[ \\t]*|(?<=[.;:,])[ \\t]+|(?<=\\by)[ \\t]+)" +
                    "(?<numeral>(?=[IVXL])(?:XL|L?X{0,3})(?:IX|IV|V?I{0,3}))" +
                    "(?:[ \\t]*(?:\\.(?![A-Z]\\.)[ \\t]*[" + DASHES + "]?|\\)|[" + DASHES + "]|:)|[ \\t]{2,}(?=\\S))" +
                    "[ \\t]*",
            Pattern.MULTILINE
    );

    private static final Pattern TRANSITORY_HEADER = Pattern.compile(
            "^[ \\t]*(?:(?:DE[ \\t]+LOS[ \\t]+)?ARTICULOS?[ \\t]+)?" + spaced("TRANSITORIO") + "(?:[ \\t]?S)?" +
                    "[ \\t]*[.:]?[ \\t]*$",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE
    );

    private static final Pattern TRANSITORY_ARTICLE = Pattern.compile(
            "^[ \\t]*(?:(?:ARTICULO|ART\\.)[ \\t]*)?" +
                    "(?<ordinal>" + ORDINAL_WORD + "|\\d+(?:o(?![A-Z0-9])|\\u00BA|\\u00B0)?)" +
                    "(?:[ \\t]+TRANSITORIO)?" +
                    "[ \\t]*(?:\\.[ \\t]*[" + DASHES + "]?|[" + DASHES + ":])[ \\t]*",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ROMAN_LETTERS = Pattern.compile("[IVXLCDM]+");

    private static final Pattern HEADING_REST_EMPTY = Pattern.compile("[ \\t.:" + DASHES + "]*");

    // ── Public API ──

    /**
     * Level headers ({@code LIBRO}, {@code TÍTULO}, {@code CAPÍTULO}, {@code SECCIÓN}) in [from, to).
     * The marker end is the end of the heading, including a name line taken from below a bare header.
     */
    public List<Marker> levelHeaders(SourceText source, int from, int to) {
        List<Marker> markers = new ArrayList<>();
        Matcher m = lineMatcher(LEVEL_HEADER, source, from, to);
        while (m.find()) {
            if (m.end() - m.start() > MAX_HEADING_LINE || !isOrdinal(m.group("ordinal"))) {
                continue;
            }
            int end = m.end();
            if (HEADING_REST_EMPTY.matcher(m.group("rest")).matches()) {
                end = extendWithTitleLine(source, end, to);
            }
            String label = textNormalizer.collapseWhitespace(source.slice(m.start(), end));
            markers.add(Marker.levelHeader(m.start(), end, label, levelOf(m)));
        }
        return markers;
    }

    /**
     * Article headers ("Artículo 5", "ARTÍCULO 5o.-", "Art. 5 Bis") in [from, to).
     */
    public List<Marker> articleHeaders(SourceText source, int from, int to) {
        List<Marker> markers = new ArrayList<>();
        Matcher m = lineMatcher(ARTICLE_HEADER, source, from, to);
        while (m.find()) {
            int number;
            try {
                number = Integer.parseInt(m.group("number"));
            } catch (NumberFormatException e) {
                // More digits than an int holds: not an article number
                continue;
            }
            String suffix = m.group("suffix") != null ? m.group("suffix")
                    : m.group("letter") != null ? m.group("letter") : "";
            String label = textNormalizer.collapseWhitespace(source.slice(m.start(), m.end()));
            markers.add(Marker.articleHeader(m.start(), m.end(), label, number,
                    suffix.toUpperCase(Locale.ROOT)));
        }
        return markers;
    }

    /**
     * Fraction markers inside an article body [from, to). Located by scanning, so several
     * markers on one line are all found. Markers at {@code from} count as line starts.
     */
    public List<Marker> fractionMarkers(SourceText source, int from, int to) {
        List<Marker> markers = new ArrayList<>();
        Matcher m = FRACTION_MARKER.matcher(source.folded());
        m.region(from, to);
        while (m.find()) {
            markers.add(Marker.fraction(m.start("numeral"), m.end(), source.slice(m.start("numeral"), m.end("numeral"))));
        }
        return markers;
    }

    /**
     * Transitory block headers ("TRANSITORIOS", "T R A N S I T O R I O S",
     * "DE LOS ARTÍCULOS TRANSITORIOS") in [from, to). The whole line must be the header.
     */
    public List<Marker> transitoryHeaders(SourceText source, int from, int to) {
        List<Marker> markers = new ArrayList<>();
        Matcher m = lineMatcher(TRANSITORY_HEADER, source, from, to);
        while (m.find()) {
            String label = textNormalizer.collapseWhitespace(source.slice(m.start(), m.end()));
            markers.add(Marker.transitoryHeader(m.start(), m.end(), label));
        }
        return markers;
    }

    /**
     * Transitory article headers ("Único.", "PRIMERO.-", "Artículo Segundo.", "1o.") in [from, to).
     * The marker label is the ordinal as written; the token is its canonical form, or the
     * label itself when the vocabulary does not know it.
     */
    public List<Marker> transitoryArticles(SourceText source, int from, int to) {
        List<Marker> markers = new ArrayList<>();
        Matcher m = lineMatcher(TRANSITORY_ARTICLE, source, from, to);
        while (m.find()) {
            String written = textNormalizer.collapseWhitespace(source.slice(m.start("ordinal"), m.end("ordinal")));
            String canonical = OrdinalVocabulary.resolve(written).orElse(written);
            markers.add(Marker.transitoryArticle(m.start(), m.end(), written, canonical));
        }
        return markers;
    }

    /**
     * True if a level, article or transitory header starts the line at {@code lineStart}.
     */
    public boolean isHeaderLine(SourceText source, int lineStart, int lineEnd) {
        return !levelHeaders(source, lineStart, lineEnd).isEmpty()
                || !articleHeaders(source, lineStart, lineEnd).isEmpty()
                || !transitoryHeaders(source, lineStart, lineEnd).isEmpty();
    }

    // ── Internals ──

    private static Matcher lineMatcher(Pattern pattern, SourceText source, int from, int to) {
        Matcher m = pattern.matcher(source.folded());
        m.region(from, to);
        // ^ and $ keep their line meaning at region bounds instead of matching there
        m.useAnchoringBounds(false);
        return m;
    }

    private int extendWithTitleLine(SourceText source, int headingEnd, int to) {
        String folded = source.folded();
        int lineStart = headingEnd;
        // Skip the break after the heading and any blank lines
        while (lineStart < to && (folded.charAt(lineStart) == '\n' || folded.charAt(lineStart) == ' ')) {
            lineStart++;
        }
        if (lineStart >= to) {
            return headingEnd;
        }
        int lineEnd = folded.indexOf('\n', lineStart);
        if (lineEnd < 0 || lineEnd > to) {
            lineEnd = to;
        }
        if (lineEnd - lineStart > MAX_HEADING_TITLE_LINE) {
            return headingEnd;
        }
        if (isHeaderLine(source, lineStart, lineEnd)
                || !transitoryArticles(source, lineStart, lineEnd).isEmpty()
                || !fractionMarkers(source, lineStart, lineEnd).isEmpty()) {
            return headingEnd;
        }
        return lineEnd;
    }

    // "CIVIL" or "MIL" are words spelled with numeral letters, not ordinals
    private static boolean isOrdinal(String ordinal) {
        return !ROMAN_LETTERS.matcher(ordinal).matches() || RomanNumerals.isRoman(ordinal);
    }

    private static HierarchyLevel levelOf(Matcher m) {
        if (m.group("libro") != null) return HierarchyLevel.LIBRO;
        if (m.group("titulo") != null) return HierarchyLevel.TITULO;
        if (m.group("capitulo") != null) return HierarchyLevel.CAPITULO;
        return HierarchyLevel.SECCION;
    }

    /**
     * Upper-case or capitalized keyword, the upper-case form also letter-spaced.
     */
    private static String keyword(String keyword) {
        String capitalized = keyword.charAt(0) + keyword.substring(1).toLowerCase(Locale.ROOT);
        return spaced(keyword) + "|" + capitalized;
    }

    /**
     * Keyword regex that also accepts the letter-spaced form ("T R A N S I T O R I O").
     */
    private static String spaced(String keyword) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < keyword.length(); i++) {
            if (i > 0) {
                sb.append("[ \\t]?");
            }
            sb.append(keyword.charAt(i));
        }
        return sb.toString();
    }
}

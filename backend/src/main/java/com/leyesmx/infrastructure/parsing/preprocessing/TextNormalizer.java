package com.leyesmx.infrastructure.parsing.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Text canonicalization for statute parsing.
 * <p>
 * {@link #clean(String)} is applied once to the raw transcription and yields the text
 * every stored field is cut from. {@link #fold(String)} produces the matching view the
 * patterns run on: same length as its input, so match offsets are original offsets.
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Any whitespace run, non-breaking and typographic spaces included
    private static final Pattern WHITESPACE_RUN = Pattern.compile(
            "[\\s\\u00A0\\u1680\\u2000-\\u200A\\u202F\\u205F\\u3000]+"
    );

    /**
     * Canonicalize a raw transcription.
     *
     * @param text raw document text
     * @return NFC text without invisible/control characters and with \n line breaks
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 3. Remove control characters (except \n, \r, \t)
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 4. Normalize \r\n to \n
        return result.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Length-preserving matching view: diacritics folded per character and every
     * whitespace variant except the line break mapped to an ASCII space.
     */
    public String fold(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            sb.append(foldChar(text.charAt(i)));
        }
        return sb.toString();
    }

    /**
     * Matching view with folded diacritics and whitespace collapsed to single spaces.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return collapseWhitespace(fold(text));
    }

    /**
     * Collapse whitespace runs (line breaks included) to one space and trim.
     * Diacritics are left untouched.
     */
    public String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
    }

    private static char foldChar(char c) {
        if (c == '\n') {
            return c;
        }
        if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
            return ' ';
        }
        if (c < 0x80 || Character.isSurrogate(c)) {
            return c;
        }
        String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        char base = decomposed.charAt(0);
        return Character.isLetter(base) ? base : c;
    }
}

package com.leyesmx.infrastructure.parsing.pattern;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed vocabulary of Spanish textual ordinals used to number transitory articles.
 * Lookups are accent- and case-insensitive; results are rendered with accents restored.
 */
public final class OrdinalVocabulary {

    private static final List<String> UNITS = List.of(
            "Primero", "Segundo", "Tercero", "Cuarto", "Quinto",
            "Sexto", "Séptimo", "Sétimo", "Octavo", "Noveno"
    );

    private static final List<String> TENS = List.of(
            "Décimo", "Undécimo", "Duodécimo", "Vigésimo", "Trigésimo",
            "Cuadragésimo", "Quincuagésimo"
    );

    private static final Map<String, String> UNIT_FORMS = new LinkedHashMap<>();
    private static final Map<String, String> TENS_FORMS = new LinkedHashMap<>();

    static {
        for (String unit : UNITS) {
            putGendered(UNIT_FORMS, unit);
        }
        UNIT_FORMS.put("PRIMER", "Primer");
        UNIT_FORMS.put("TERCER", "Tercer");
        for (String tens : TENS) {
            putGendered(TENS_FORMS, tens);
        }
    }

    private OrdinalVocabulary() {}

    /**
     * Resolve an ordinal token ("ÚNICO", "Decimo primero", "VIGÉSIMA SEGUNDA").
     *
     * @return the canonical rendering, or empty when the token is not in the vocabulary
     */
    public static Optional<String> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String key = fold(token).replaceAll("\\s+", " ").strip();
        if (key.equals("UNICO") || key.equals("UNICA")) {
            return Optional.of(key.equals("UNICO") ? "Único" : "Única");
        }
        String unit = UNIT_FORMS.get(key);
        if (unit != null) {
            return Optional.of(unit);
        }
        String tens = TENS_FORMS.get(key);
        if (tens != null) {
            return Optional.of(tens);
        }
        for (Map.Entry<String, String> entry : TENS_FORMS.entrySet()) {
            if (key.startsWith(entry.getKey())) {
                String rest = key.substring(entry.getKey().length()).strip();
                String restUnit = UNIT_FORMS.get(rest);
                if (restUnit != null) {
                    return Optional.of(entry.getValue() + " " + restUnit);
                }
            }
        }
        return Optional.empty();
    }

    private static void putGendered(Map<String, String> forms, String masculine) {
        String feminine = masculine.substring(0, masculine.length() - 1) + "a";
        forms.put(fold(masculine), masculine);
        forms.put(fold(feminine), feminine);
    }

    private static String fold(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toUpperCase(Locale.ROOT);
    }
}

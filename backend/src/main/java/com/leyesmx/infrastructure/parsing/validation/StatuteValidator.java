package com.leyesmx.infrastructure.parsing.validation;

import com.leyesmx.domain.statute.model.Article;
import com.leyesmx.domain.statute.model.Chapter;
import com.leyesmx.domain.statute.model.DocumentMetadata;
import com.leyesmx.domain.statute.model.Fraction;
import com.leyesmx.domain.statute.model.ParseIssue;
import com.leyesmx.domain.statute.model.ParseIssue.Severity;
import com.leyesmx.domain.statute.model.ParseIssueType;
import com.leyesmx.domain.statute.model.StatuteDocument;
import com.leyesmx.domain.statute.model.TransitoryArticle;
import com.leyesmx.domain.statute.model.TransitoryChapter;
import com.leyesmx.domain.statute.model.ValidationResult;
import com.leyesmx.infrastructure.parsing.pattern.RomanNumerals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based check of an assembled statute before it is written.
 * Structural, range and shape violations are errors; missing front matter and an
 * empty transitory block are warnings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatuteValidator {

    private final Clock clock;

    public ValidationResult validate(StatuteDocument document) {
        List<ParseIssue> issues = new ArrayList<>();

        checkHasArticles(document, issues);
        checkYearRange(document, issues);
        checkChapterShape(document, issues);
        checkTransitoryShape(document, issues);
        checkAdvisoryGaps(document, issues);

        if (!issues.isEmpty()) {
            log.debug("Validation completed: {} issues ({} errors, {} warnings)",
                    issues.size(),
                    issues.stream().filter(i -> i.severity() == Severity.ERROR).count(),
                    issues.stream().filter(i -> i.severity() == Severity.WARNING).count());
        }
        return ValidationResult.of(issues);
    }

    private void checkHasArticles(StatuteDocument document, List<ParseIssue> issues) {
        if (document.articleCount() == 0) {
            issues.add(ParseIssue.error(ParseIssueType.STRUCTURAL_FAILURE,
                    "No normative article was found"));
        }
    }

    private void checkYearRange(StatuteDocument document, List<ParseIssue> issues) {
        Integer year = document.anioPublicacion();
        if (year == null) {
            return;
        }
        int currentYear = Year.now(clock).getValue();
        if (year < DocumentMetadata.MIN_YEAR || year > currentYear) {
            issues.add(new ParseIssue(ParseIssueType.RANGE_VIOLATION, Severity.ERROR,
                    "Publication year " + year + " is outside [" + DocumentMetadata.MIN_YEAR + ", " + currentYear + "]",
                    String.valueOf(year)));
        }
    }

    private void checkChapterShape(StatuteDocument document, List<ParseIssue> issues) {
        for (Chapter chapter : document.capitulos()) {
            if (chapter.label() == null || chapter.label().isBlank()) {
                issues.add(ParseIssue.error(ParseIssueType.SHAPE_VIOLATION, "Chapter without a label"));
            }
            for (Article article : chapter.articulos()) {
                String where = "Artículo " + article.numero();
                checkText(article.texto(), where, issues);
                checkFractions(article.fracciones(), where, issues);
            }
        }
    }

    private void checkTransitoryShape(StatuteDocument document, List<ParseIssue> issues) {
        List<TransitoryChapter> transitorios = document.transitorios();
        if (transitorios.size() > 1) {
            issues.add(ParseIssue.error(ParseIssueType.SHAPE_VIOLATION,
                    "Expected at most one transitory chapter, found " + transitorios.size()));
        }
        for (TransitoryChapter chapter : transitorios) {
            if (!Chapter.FALLBACK_LABEL.equals(chapter.label())) {
                issues.add(new ParseIssue(ParseIssueType.SHAPE_VIOLATION, Severity.ERROR,
                        "Transitory chapter must be labeled " + Chapter.FALLBACK_LABEL, chapter.label()));
            }
            for (TransitoryArticle article : chapter.articulos()) {
                String where = "Transitorio " + article.ordinal();
                if (article.ordinal() == null || article.ordinal().isBlank()) {
                    issues.add(ParseIssue.error(ParseIssueType.SHAPE_VIOLATION, "Transitory article without ordinal"));
                }
                checkText(article.texto(), where, issues);
                checkFractions(article.fracciones(), where, issues);
            }
        }
    }

    private void checkFractions(List<Fraction> fracciones, String where, List<ParseIssue> issues) {
        for (Fraction fraction : fracciones) {
            if (fraction.label() == null || !RomanNumerals.isRoman(fraction.label())) {
                issues.add(new ParseIssue(ParseIssueType.SHAPE_VIOLATION, Severity.ERROR,
                        where + ": fraction label is not a roman numeral", fraction.label()));
            }
            checkText(fraction.texto(), where + " fracción " + fraction.label(), issues);
        }
    }

    private void checkText(String text, String where, List<ParseIssue> issues) {
        if (text == null) {
            issues.add(ParseIssue.error(ParseIssueType.SHAPE_VIOLATION, where + ": missing text"));
        }
    }

    private void checkAdvisoryGaps(StatuteDocument document, List<ParseIssue> issues) {
        if (document.titulo().isEmpty()) {
            issues.add(ParseIssue.warning(ParseIssueType.EMPTY_TITLE, "No title was found"));
        }
        if (document.decreto().isEmpty()) {
            issues.add(ParseIssue.warning(ParseIssueType.EMPTY_DECREE, "No decree preamble before the normative body"));
        }
        if (document.transitorios().isEmpty()) {
            issues.add(ParseIssue.warning(ParseIssueType.NO_TRANSITORIES, "No transitory articles were found"));
        }
    }
}

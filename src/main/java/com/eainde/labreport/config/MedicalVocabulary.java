package com.eainde.labreport.config;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Curated, read-only word lists shared by the filter, parser and validator.
 *
 * <p>Patterns are matched against lowercased text unless noted otherwise.</p>
 */
public final class MedicalVocabulary {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** Bare lab code as printed on analyzer output: HGB, RBC, NEU#, LYM%, P-LCR. Case-sensitive. */
    public static final Pattern LAB_CODE = Pattern.compile("^[A-Z]{2,5}(?:-[A-Z]{2,4})?[#%]?$");

    public static final List<Pattern> MEDICAL_NAME_PATTERNS = compileAll(
            "^[a-z]{2,5}[#%]?$",
            // complete blood count
            "гемоглобин", "эритроцит", "лейкоцит", "тромбоцит", "нейтрофил", "лимфоцит",
            "моноцит", "эозинофил", "базофил", "гематокрит",
            // biochemistry
            "белок", "альбумин", "креатинин", "глюкоза", "магний", "алт", "алат", "аст", "асат",
            "билирубин", "ггт", "ггтп", "гамма.?гт", "щелочная.?фосфатаза", "щф", "гликированный",
            "гликозилированный", "реактивный.?белок", "срб", "холестерин", "лпвп", "лпнп",
            "триглицерид", "калий", "натрий", "мочевина", "амилаза", "кальций", "мочевая",
            // hormones
            "ттг", "тиреотропный", "свободный.?т[34з]", "витамин.?d", "25.?он", "25.?oh",
            // coagulation
            "ачтв", "аптв", "мно", "протромбин", "тромбиновое", "фибриноген",
            // hepatitis markers
            "антитела", "гепатит", "hbsag", "anti.?hcv",
            // common abbreviations
            "соэ", "^t$", "^ph$", "hba1c", "crp", "hdl", "ldl", "tsh", "ft[34]", "inr",
            // English names
            "hemoglobin", "glucose", "cholesterol", "bilirubin", "creatinine", "platelet",
            "cells", "protein", "albumin", "thrombin", "vitamin", "hepatitis");

    public static final List<String> MEDICAL_NAME_SUFFIXES = List.of("цит", "глобин", "фил", "коз", "тромб");

    /** Single-character labels accepted despite the length band. */
    public static final List<String> SINGLE_LETTER_CODES = List.of("T", "P", "R", "H", "K");

    public static final List<Pattern> SECTION_HEADER_PATTERNS = compileAll(
            "абс\\s*:\\s*кол-во", "общий\\s+анализ", "биохимический", "клинический", "показатели",
            "результаты", "пациент", "заключение", "описание", "комментарий",
            "complete\\s+blood\\s+count", "results", "conclusion", "comment");

    public static final List<Pattern> DEMOGRAPHIC_PATTERNS = compileAll(
            "^возраст$", "^пол$", "^id$", "^номер$", "^кабинет$", "^врач$", "^пациент$", "^фио$",
            "^дата\\s+рождения$", "^age$", "^sex$", "^gender$", "^room$", "^doctor$", "^patient$", "^name$");

    /** Names of tests whose result is a qualitative word rather than a number. */
    public static final List<Pattern> QUALITATIVE_TEST_PATTERNS = compileAll(
            "антитела", "гепатит", "маркер", "анти", "hbs", "hcv");

    public static final List<String> QUALITATIVE_KEYWORDS = List.of(
            "обнаружено", "не обнаружено", "отрицательно", "положительно", "позитивно", "негативно",
            "negative", "positive", "detected");

    /** Medical words in a label that make a "time"-like word part of a test name. */
    public static final List<Pattern> TIME_CONTEXT_PATTERNS = compileAll(
            "витамин", "протромбин", "тромбин", "тромбопластин", "25.?он", "25.?oh", "ачтв", "аптв",
            "prothrombin", "thrombin", "thromboplastin", "vitamin", "coagulation");

    public static final Pattern DATETIME_KEYWORD = Pattern.compile(
            "(?<![а-яёa-z0-9_])(дата|время|date|time|час|мин|сек)(?![а-яёa-z0-9_])", FLAGS);

    public static final List<Pattern> UNIT_INDICATORS = compileAll(
            "г/л", "мг/дл", "ммоль/л", "мкмоль/л", "%", "пг", "фл", "/л", "мм/час", "мм/ч",
            "10\\^", "e\\+", "×", "°c", "°f", "ед",
            "u/l", "ме/л", "мг/л", "мкг/л", "нг/мл", "пг/мл", "нг/дл", "мкме/мл", "g/l", "mmol/l",
            "mg/dl", "fl", "pg", "s/co",
            "сек", "(?<![а-яё])с(?![а-яё])",
            "обнаружено", "положительно", "отрицательно", "позитивно", "негативно");

    public static final List<String> DOCUMENT_KEYWORDS = List.of(
            "анализ", "кровь", "моча", "глюкоза", "холестерин", "лейкоциты", "эритроциты",
            "гемоглобин", "метаболизм", "диагностика", "результат", "пациент", "норма",
            "blood", "test", "result", "cholesterol", "glucose", "patient", "hemoglobin",
            "normal", "range", "white blood cells", "red blood cells", "lab", "laboratory");

    /** Administrative text that never belongs inside a value fragment. */
    public static final List<Pattern> CONTAMINATION_PATTERNS = compileAll(
            "\\d{2}\\.\\d{2}\\.\\d{4}", "\\d{4}\\.\\d{2}\\.\\d{2}",
            "алу орны", "биоматериалды", "результатах", "отчет");

    public static final Pattern DATE = Pattern.compile(
            "\\d{1,2}[./]\\d{1,2}[./]\\d{4}|\\d{4}[./-]\\d{1,2}[./-]\\d{1,2}");

    private MedicalVocabulary() {
    }

    public static boolean anyFind(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsQualitativeKeyword(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : QUALITATIVE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isRecognizedMedicalName(String label) {
        String lower = label.toLowerCase(Locale.ROOT).strip();
        if (anyFind(MEDICAL_NAME_PATTERNS, lower)) {
            return true;
        }
        if (LAB_CODE.matcher(label.strip().toUpperCase(Locale.ROOT)).matches()) {
            return true;
        }
        for (String suffix : MEDICAL_NAME_SUFFIXES) {
            if (lower.contains(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileAll(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, FLAGS))
                .toList();
    }
}

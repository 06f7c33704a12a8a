package com.eainde.labreport.proximity;

import com.eainde.labreport.config.MedicalVocabulary;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape tests for single OCR fragments: does it look like a value, a range, a test
 * name, or administrative contamination.
 */
final class FragmentShapes {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> VALUE_PATTERNS = List.of(
            Pattern.compile("\\d{1,3}[,.]?\\d*\\s*(г/л|%|пг|фл|мм/час|мм/ч|мкМЕ/мл|нг/дл|нг/мл|пг/мл|ng/ml|pg/ml"
                    + "|U/L|МЕ/л|Ед/л|мг/л|мкг/л|сек|ммоль/л|мкмоль/л)", FLAGS),
            Pattern.compile("\\d+[,.]?\\d*\\s+10\\^?\\d+\\s*г?/л", FLAGS),
            Pattern.compile("\\d+[,.]?\\d*\\s*[eе]\\+?\\d+\\s*/л", FLAGS),
            Pattern.compile("\\d+[,.]?\\d*\\s*\\*\\s*10\\^?\\d+\\s*/л", FLAGS),
            Pattern.compile("s/co\\s*=\\s*\\d+[,.]?\\d*", FLAGS),
            Pattern.compile("\\d+[,.]?\\d*\\s*s/co", FLAGS));

    private static final Pattern RANGE = Pattern.compile("(\\d+[,.]?\\d*)\\s*[-–]\\s*(\\d+[,.]?\\d*)");
    private static final Pattern FROM_TO = Pattern.compile("от\\s+\\d+[,.]?\\d*\\s+до\\s+\\d+[,.]?\\d*", FLAGS);
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\d+[,.]?\\d*$");
    private static final Pattern UNIT_ONLY = Pattern.compile("^[а-яА-ЯёЁa-zA-Z/%×·*^]+$");
    private static final Pattern EXPONENT = Pattern.compile("^10\\^?\\d+");
    private static final Pattern LABELLED_LINE = Pattern.compile(":\\s*\\S");

    private static final List<Pattern> TEST_NAME_PATTERNS = List.of(
            Pattern.compile("ттг"), Pattern.compile("свободный"), Pattern.compile("витамин"),
            Pattern.compile("25.?он"), Pattern.compile("гемоглобин"), Pattern.compile("эритроциты"),
            Pattern.compile("лейкоциты"), Pattern.compile("тромбоциты"), Pattern.compile("глюкоза"),
            Pattern.compile("креатинин"), Pattern.compile("холестерин"), Pattern.compile("белок"),
            Pattern.compile("билирубин"), Pattern.compile("гепатит\\s*[a-zсв]"), Pattern.compile("hbsag"),
            Pattern.compile("антитела"), Pattern.compile("маркер"));

    private FragmentShapes() {
    }

    static boolean isValue(String fragment) {
        return MedicalVocabulary.anyFind(VALUE_PATTERNS, fragment);
    }

    static boolean isRange(String fragment) {
        return RANGE.matcher(fragment).find() || FROM_TO.matcher(fragment).find();
    }

    /**
     * @return {@code "A - B"} for a dash range, the fragment itself for {@code от A до B}, else null
     */
    static String rangeText(String fragment) {
        Matcher m = RANGE.matcher(fragment);
        if (m.find()) {
            return m.group(1) + " - " + m.group(2);
        }
        return FROM_TO.matcher(fragment).find() ? fragment : null;
    }

    static boolean isBareNumber(String fragment) {
        return BARE_NUMBER.matcher(fragment).matches();
    }

    static boolean isUnitOnly(String fragment) {
        return UNIT_ONLY.matcher(fragment).matches();
    }

    static boolean isExponent(String fragment) {
        return EXPONENT.matcher(fragment).find();
    }

    static boolean isLabCode(String fragment) {
        return MedicalVocabulary.LAB_CODE.matcher(fragment).matches();
    }

    static boolean isTestName(String fragment) {
        if (isLabCode(fragment)) {
            return true;
        }
        String lower = fragment.toLowerCase(Locale.ROOT);
        return MedicalVocabulary.anyFind(TEST_NAME_PATTERNS, lower);
    }

    /** Fragments that already read {@code label: value} belong to the structural pass. */
    static boolean isLabelledLine(String fragment) {
        return LABELLED_LINE.matcher(fragment).find();
    }

    static boolean isDateContaminated(String fragment) {
        return MedicalVocabulary.anyFind(MedicalVocabulary.CONTAMINATION_PATTERNS, fragment);
    }
}

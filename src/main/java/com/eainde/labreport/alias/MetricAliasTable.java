package com.eainde.labreport.alias;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps the many surface forms of a lab metric (abbreviations, Cyrillic and Latin
 * spellings, analyzer codes) onto one canonical name.
 *
 * <h3>Lookup order</h3>
 * <ol>
 *   <li>tabular clean-up of OCR-glued digits ({@code ТТГ1 → ТТГ})</li>
 *   <li>compound names contained anywhere in the label</li>
 *   <li>direct lookup after dropping {@code ОБЩИЙ}/{@code СВОБОДНЫЙ} prefixes and qualifier suffixes</li>
 *   <li>lookup without a trailing {@code #}, {@code %}, {@code _ABS}, {@code _PCT}</li>
 *   <li>abbreviation variants ({@code АЛАТ → АЛТ}, {@code TSH → ТТГ})</li>
 *   <li>fallback: lowercase, spaces and dashes replaced by underscores</li>
 * </ol>
 *
 * <p>Static data only; safe to share between threads.</p>
 */
@Log4j2
@Component
public class MetricAliasTable {

    private static final Map<String, String> CANONICAL = new LinkedHashMap<>();
    private static final Map<Pattern, String> TABULAR = new LinkedHashMap<>();
    private static final Map<String, String> COMPOUND = new LinkedHashMap<>();
    private static final Map<String, String> VARIANTS = new LinkedHashMap<>();
    private static final Set<String> CANONICAL_NAMES;

    private static final Pattern PREFIX = Pattern.compile("^(ОБЩИЙ\\s+|СВОБОДНЫЙ\\s+)");
    private static final Pattern FREE_HORMONE = Pattern.compile("СВОБОДНЫЙ\\s+Т[34]");
    private static final Pattern QUALIFIER_SUFFIX =
            Pattern.compile("\\s+(ОБЩИЙ|ПРЯМОЙ|НЕПРЯМОЙ|КОНЪЮГИРОВАННЫЙ|НЕКОНЪЮГИРОВАННЫЙ)$");
    private static final String[] STRIPPABLE_SUFFIXES = {"#", "%", "_ABS", "_PCT"};

    static {
        // Complete blood count
        alias("hemoglobin", "HGB", "ГЕМОГЛОБИН", "HB");
        alias("red_blood_cells", "RBC", "ЭРИТРОЦИТЫ");
        alias("platelets", "PLT", "ТРОМБОЦИТЫ");
        alias("white_blood_cells", "WBC", "ЛЕЙКОЦИТЫ");
        alias("neutrophils_absolute", "NEU#");
        alias("lymphocytes_absolute", "LYM#");
        alias("monocytes_absolute", "MON#");
        alias("eosinophils_absolute", "EOS#");
        alias("basophils_absolute", "BAS#");
        alias("neutrophils_percentage", "NEU%");
        alias("lymphocytes_percentage", "LYM%");
        alias("monocytes_percentage", "MON%");
        alias("eosinophils_percentage", "EOS%");
        alias("basophils_percentage", "BAS%");
        alias("mean_corpuscular_volume", "MCV");
        alias("mean_corpuscular_hemoglobin", "MCH");
        alias("mean_corpuscular_hemoglobin_concentration", "MCHC");
        alias("red_cell_distribution_width", "RDW");
        alias("plateletcrit", "PCT");
        alias("mean_platelet_volume", "MPV");
        alias("platelet_distribution_width", "PDW");
        alias("platelet_large_cell_ratio", "P-LCR");
        alias("hematocrit", "HCT", "ГЕМАТОКРИТ");
        alias("erythrocyte_sedimentation_rate", "СОЭ", "ESR");

        // Biochemistry
        alias("total_protein", "ОБЩИЙ БЕЛОК", "БЕЛОК");
        alias("albumin", "АЛЬБУМИН");
        alias("creatinine", "КРЕАТИНИН");
        alias("glucose", "ГЛЮКОЗА", "ГЛЮКОЗА (САХАР КРОВИ)", "GLU");
        alias("magnesium", "МАГНИЙ");
        alias("alt_alanine_aminotransferase", "АЛТ", "АЛАНИНАМИНОТРАНСФЕРАЗА",
                "АЛАНИНАМИНОТРАНСФЕРАЗА (АЛТ)", "ALT");
        alias("ast_aspartate_aminotransferase", "АСТ", "АСПАРТАТАМИНОТРАСФЕРАЗА",
                "АСПАРТАТАМИНОТРАНСФЕРАЗА", "АСПАРТАТАМИНОТРАСФЕРАЗА (АСТ)", "AST");
        alias("total_bilirubin", "БИЛИРУБИН ОБЩИЙ");
        alias("direct_bilirubin", "БИЛИРУБИН ПРЯМОЙ");
        alias("indirect_bilirubin", "БИЛИРУБИН НЕПРЯМОЙ");
        alias("gamma_glutamyl_transferase", "ГГТ", "ГАММАГЛЮТАМИЛТРАНСФЕРАЗА",
                "ГАММАГЛЮТАМИЛТРАНСФЕРАЗА (ГГТП)", "GGT");
        alias("alkaline_phosphatase", "ЩЕЛОЧНАЯ ФОСФАТАЗА", "ЩЕЛОЧНАЯ ФОСФАТАЗА (ЩФ)", "ALP");
        alias("glycated_hemoglobin", "ГЛИКИРОВАННЫЙ ГЕМОГЛОБИН", "HBA1C");
        alias("c_reactive_protein", "С-РЕАКТИВНЫЙ БЕЛОК");
        alias("total_cholesterol", "ХОЛЕСТЕРИН");
        alias("hdl_cholesterol", "ХОЛЕСТЕРИН ЛПВП");
        alias("ldl_cholesterol", "ХОЛЕСТЕРИН ЛПНП");
        alias("vldl_cholesterol", "ХОЛЕСТЕРИН ЛПОНП", "ЛПОНП");
        alias("triglycerides", "ТРИГЛИЦЕРИДЫ");
        alias("potassium", "КАЛИЙ");
        alias("sodium", "НАТРИЙ");
        alias("urea", "МОЧЕВИНА");
        alias("calcium", "КАЛЬЦИЙ");
        alias("uric_acid", "МОЧЕВАЯ КИСЛОТА");
        alias("amylase", "АМИЛАЗА");
        alias("alpha_amylase", "АЛЬФА-АМИЛАЗА");

        // Hormones
        alias("thyroid_stimulating_hormone", "ТТГ");
        alias("free_t3", "СВОБОДНЫЙ Т3");
        alias("free_t4", "СВОБОДНЫЙ Т4");
        alias("vitamin_d_25_oh", "25-ОН ВИТАМИН D", "25(OH)D");

        // Coagulation
        alias("activated_partial_thromboplastin_time", "АЧТВ");
        alias("international_normalized_ratio", "МНО");
        alias("prothrombin_time", "ПРОТРОМБИНОВОЕ ВРЕМЯ");
        alias("thrombin_time", "ТРОМБИНОВОЕ ВРЕМЯ");
        alias("prothrombin_index", "ПРОТРОМБИНОВЫЙ ИНДЕКС");
        alias("fibrinogen", "ФИБРИНОГЕН");

        // Viral hepatitis markers; OCR mixes Latin C and Cyrillic С
        alias("hepatitis_c_antibodies", "АНТИТЕЛА К ГЕПАТИТУ C", "АНТИТЕЛА К ГЕПАТИТУ С");
        alias("hepatitis_b_surface_antigen", "HBSAG", "ГЕПАТИТ B", "ГЕПАТИТ В", "HBSAG (ГЕПАТИТ B)",
                "HBSAG (ГЕПАТИТ В)");
        alias("hepatitis_c_total_antibodies", "ГЕПАТИТ C (СУММАРНЫЕ АНТИТЕЛА)",
                "ГЕПАТИТ С (СУММАРНЫЕ АНТИТЕЛА)");

        TABULAR.put(Pattern.compile("^ТТГ\\d*$"), "ТТГ");
        TABULAR.put(Pattern.compile("СВОБОДНЫЙ\\s+Т4\\s*\\d*$"), "СВОБОДНЫЙ Т4");
        TABULAR.put(Pattern.compile("СВОБОДНЫЙ\\s+Т[З3]\\s*\\d*$"), "СВОБОДНЫЙ Т3");
        TABULAR.put(Pattern.compile("25.?[ОO][HН]?\\s+ВИТАМИН\\s+D[A-Z]*"), "25-ОН ВИТАМИН D");

        COMPOUND.put("БИЛИРУБИН ОБЩИЙ", "БИЛИРУБИН ОБЩИЙ");
        COMPOUND.put("БИЛИРУБИН НЕПРЯМОЙ", "БИЛИРУБИН НЕПРЯМОЙ");
        COMPOUND.put("БИЛИРУБИН ПРЯМОЙ", "БИЛИРУБИН ПРЯМОЙ");
        COMPOUND.put("БИЛИРУБИН НЕКОНЪЮГИРОВАННЫЙ", "БИЛИРУБИН НЕПРЯМОЙ");
        COMPOUND.put("БИЛИРУБИН КОНЪЮГИРОВАННЫЙ", "БИЛИРУБИН ПРЯМОЙ");
        COMPOUND.put("ХОЛЕСТЕРИН ЛПОНП", "ХОЛЕСТЕРИН ЛПОНП");
        COMPOUND.put("ХОЛЕСТЕРИН ЛПВП", "ХОЛЕСТЕРИН ЛПВП");
        COMPOUND.put("ХОЛЕСТЕРИН ЛПНП", "ХОЛЕСТЕРИН ЛПНП");
        COMPOUND.put("ХОЛЕСТЕРИН ОБЩИЙ", "ХОЛЕСТЕРИН");
        COMPOUND.put("ГЛИКИРОВАННЫЙ ГЕМОГЛОБИН", "ГЛИКИРОВАННЫЙ ГЕМОГЛОБИН");
        COMPOUND.put("ГЛИКОЗИЛИРОВАННЫЙ ГЕМОГЛОБИН", "ГЛИКИРОВАННЫЙ ГЕМОГЛОБИН");
        COMPOUND.put("С-РЕАКТИВНЫЙ БЕЛОК", "С-РЕАКТИВНЫЙ БЕЛОК");
        COMPOUND.put("ЩЕЛОЧНАЯ ФОСФАТАЗА", "ЩЕЛОЧНАЯ ФОСФАТАЗА");
        COMPOUND.put("ПРОТРОМБИНОВОЕ ВРЕМЯ", "ПРОТРОМБИНОВОЕ ВРЕМЯ");
        COMPOUND.put("ТРОМБИНОВОЕ ВРЕМЯ", "ТРОМБИНОВОЕ ВРЕМЯ");
        COMPOUND.put("ПРОТРОМБИНОВЫЙ ИНДЕКС", "ПРОТРОМБИНОВЫЙ ИНДЕКС");
        COMPOUND.put("АНТИТЕЛА К ГЕПАТИТУ C", "АНТИТЕЛА К ГЕПАТИТУ C");
        COMPOUND.put("АНТИТЕЛА К ГЕПАТИТУ С", "АНТИТЕЛА К ГЕПАТИТУ С");
        COMPOUND.put("25-ОН ВИТАМИН D", "25-ОН ВИТАМИН D");
        COMPOUND.put("СВОБОДНЫЙ Т3", "СВОБОДНЫЙ Т3");
        COMPOUND.put("СВОБОДНЫЙ Т4", "СВОБОДНЫЙ Т4");

        VARIANTS.put("АЛАТ", "АЛТ");
        VARIANTS.put("АСАТ", "АСТ");
        VARIANTS.put("ГГТП", "ГГТ");
        VARIANTS.put("ГАММА-ГТ", "ГГТ");
        VARIANTS.put("ГАММА ГТ", "ГГТ");
        VARIANTS.put("ЩФ", "ЩЕЛОЧНАЯ ФОСФАТАЗА");
        VARIANTS.put("СРБ", "С-РЕАКТИВНЫЙ БЕЛОК");
        VARIANTS.put("CRP", "С-РЕАКТИВНЫЙ БЕЛОК");
        VARIANTS.put("ЛПВП", "ХОЛЕСТЕРИН ЛПВП");
        VARIANTS.put("ЛПНП", "ХОЛЕСТЕРИН ЛПНП");
        VARIANTS.put("HDL", "ХОЛЕСТЕРИН ЛПВП");
        VARIANTS.put("LDL", "ХОЛЕСТЕРИН ЛПНП");
        VARIANTS.put("TSH", "ТТГ");
        VARIANTS.put("FT3", "СВОБОДНЫЙ Т3");
        VARIANTS.put("FT4", "СВОБОДНЫЙ Т4");
        VARIANTS.put("ГЛИКОЗИЛИРОВАННЫЙ ГЕМОГЛОБИН", "ГЛИКИРОВАННЫЙ ГЕМОГЛОБИН");
        VARIANTS.put("INR", "МНО");
        VARIANTS.put("АПТВ", "АЧТВ");
        VARIANTS.put("APTT", "АЧТВ");
        VARIANTS.put("ПВ", "ПРОТРОМБИНОВОЕ ВРЕМЯ");
        VARIANTS.put("ТВ", "ТРОМБИНОВОЕ ВРЕМЯ");
        VARIANTS.put("ПТИ", "ПРОТРОМБИНОВЫЙ ИНДЕКС");
        VARIANTS.put("ANTI-HCV", "АНТИТЕЛА К ГЕПАТИТУ C");
        VARIANTS.put("HCV", "АНТИТЕЛА К ГЕПАТИТУ C");
        VARIANTS.put("HBS AG", "HBSAG");
        VARIANTS.put("ВИТАМИН D", "25-ОН ВИТАМИН D");

        CANONICAL_NAMES = Collections.unmodifiableSet(new HashSet<>(CANONICAL.values()));
    }

    private static void alias(String canonical, String... surfaceForms) {
        for (String form : surfaceForms) {
            CANONICAL.put(form, canonical);
        }
    }

    /**
     * Resolves a raw label to its canonical metric name.
     *
     * @param rawName label as it appeared in the document
     * @return canonical name; never blank for a non-blank input
     */
    public String resolve(String rawName) {
        String stripped = rawName.strip();
        if (isCanonical(stripped)) {
            return stripped;
        }
        String upper = stripped.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        String clean = upper;

        for (Map.Entry<Pattern, String> tabular : TABULAR.entrySet()) {
            if (tabular.getKey().matcher(clean).find()) {
                clean = tabular.getValue();
                break;
            }
        }

        if (!FREE_HORMONE.matcher(clean).find()) {
            clean = PREFIX.matcher(clean).replaceFirst("");
        }
        clean = QUALIFIER_SUFFIX.matcher(clean).replaceFirst("");

        for (Map.Entry<String, String> compound : COMPOUND.entrySet()) {
            if (upper.contains(compound.getKey())) {
                String canonical = CANONICAL.get(compound.getValue());
                if (canonical != null) {
                    return canonical;
                }
            }
        }

        String direct = CANONICAL.get(clean);
        if (direct != null) {
            return direct;
        }

        for (String suffix : STRIPPABLE_SUFFIXES) {
            if (clean.endsWith(suffix)) {
                String base = CANONICAL.get(clean.substring(0, clean.length() - suffix.length()));
                if (base != null) {
                    return base;
                }
            }
        }

        String variant = VARIANTS.get(clean);
        if (variant != null && CANONICAL.containsKey(variant)) {
            return CANONICAL.get(variant);
        }

        String fallback = clean.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        if (!CANONICAL_NAMES.contains(fallback)) {
            log.debug("No alias for '{}', using '{}'", rawName, fallback);
        }
        return fallback;
    }

    /**
     * @return true when {@code name} is one of the canonical names this table produces
     */
    public boolean isCanonical(String name) {
        return CANONICAL_NAMES.contains(name);
    }

    static Set<String> canonicalNames() {
        return CANONICAL_NAMES;
    }
}

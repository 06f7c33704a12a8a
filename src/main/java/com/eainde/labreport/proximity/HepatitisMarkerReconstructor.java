package com.eainde.labreport.proximity;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pairs the qualitative verdict and the S/CO reading of anti-HCV and HBsAg tests
 * when OCR emitted them as separate fragments:
 *
 * <pre>
 *   "Гепатит C (суммарные антитела)" "Не обнаружено" "S/CO = 0,13"
 *     →  "Гепатит C (суммарные антитела): Не обнаружено, S/CO = 0,13 (норма: S/CO &lt; 1,0)"
 * </pre>
 */
@Log4j2
public class HepatitisMarkerReconstructor implements FragmentReconstructor {

    static final String HEPATITIS_C = "Гепатит C (суммарные антитела)";
    static final String HEPATITIS_B = "HBsAg (гепатит B)";
    static final String CUTOFF_RANGE = "S/CO < 1,0";

    private static final Pattern HEPATITIS_C_ANCHOR = Pattern.compile("гепатит\\s*[cс](?![а-яёa-z])|anti.?hcv");
    private static final Pattern HEPATITIS_B_ANCHOR = Pattern.compile("hbs\\s*ag");
    private static final Pattern SIGNAL_CUTOFF = Pattern.compile("S/CO\\s*=\\s*(\\d+[,.]?\\d*)", Pattern.CASE_INSENSITIVE);
    // OCR often reads the Cyrillic "Не" as Latin "He".
    private static final Pattern NOT_DETECTED = Pattern.compile("(?:не|he)\\s+обнаружено");
    private static final Pattern DETECTED = Pattern.compile("(?<![а-яё])обнаружено");

    private final int window;

    public HepatitisMarkerReconstructor(int window) {
        this.window = window;
    }

    @Override
    public String name() {
        return "hepatitis-marker";
    }

    @Override
    public List<String> reconstruct(List<String> fragments) {
        List<String> lines = new ArrayList<>();
        int i = 0;
        while (i < fragments.size()) {
            Optional<String> testName = anchor(fragments.get(i));
            if (testName.isEmpty()) {
                i++;
                continue;
            }
            String verdict = null;
            String cutoff = null;
            int j = i;
            int end = Math.min(fragments.size(), i + window);
            for (; j < end; j++) {
                String current = fragments.get(j);
                if (j > i && anchor(current).isPresent()) {
                    break;
                }
                if (FragmentShapes.isDateContaminated(current)) {
                    continue;
                }
                String lower = current.toLowerCase(Locale.ROOT);
                if (verdict == null) {
                    if (NOT_DETECTED.matcher(lower).find()) {
                        verdict = "Не обнаружено";
                    } else if (DETECTED.matcher(lower).find()) {
                        verdict = "Обнаружено";
                    }
                }
                Matcher m = SIGNAL_CUTOFF.matcher(current);
                if (cutoff == null && m.find()) {
                    cutoff = m.group(1);
                }
            }
            if (verdict != null && cutoff != null) {
                String line = testName.get() + ": " + verdict + ", S/CO = " + cutoff + " (норма: " + CUTOFF_RANGE + ")";
                lines.add(line);
                log.debug("Paired hepatitis marker: {}", line);
            }
            i = Math.max(i + 1, j);
        }
        return lines;
    }

    private static Optional<String> anchor(String fragment) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        if (HEPATITIS_B_ANCHOR.matcher(lower).find()) {
            return Optional.of(HEPATITIS_B);
        }
        if (HEPATITIS_C_ANCHOR.matcher(lower).find()) {
            return Optional.of(HEPATITIS_C);
        }
        return Optional.empty();
    }
}

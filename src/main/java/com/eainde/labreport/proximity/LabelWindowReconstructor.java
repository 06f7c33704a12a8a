package com.eainde.labreport.proximity;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic row reconstruction. From each test-name or lab-code fragment it looks
 * ahead for the first value-shaped fragment and the first range, stopping at the
 * next test name.
 *
 * <pre>
 *   "RBC" "5.66" "10^12/л" "4,50 - 5,90"   →  "RBC: 5.66 10^12/л (норма: 4,50 - 5,90)"
 *   "ТТГ1" "1,33 мкМЕ/мл" "0,35" "4,94"     →  "ТТГ1: 1,33 мкМЕ/мл (норма: 0,35 - 4,94)"
 * </pre>
 */
@Log4j2
public class LabelWindowReconstructor implements FragmentReconstructor {

    private static final int CONTINUATION_LOOKAHEAD = 2;

    private final int labelWindow;
    private final int labCodeWindow;

    public LabelWindowReconstructor(int labelWindow, int labCodeWindow) {
        this.labelWindow = labelWindow;
        this.labCodeWindow = labCodeWindow;
    }

    @Override
    public String name() {
        return "label-window";
    }

    @Override
    public List<String> reconstruct(List<String> fragments) {
        List<String> lines = new ArrayList<>();
        int i = 0;
        while (i < fragments.size()) {
            String anchor = fragments.get(i);
            if (!isAnchor(anchor)) {
                i++;
                continue;
            }
            int window = FragmentShapes.isLabCode(anchor) ? labCodeWindow : labelWindow;
            int end = Math.min(fragments.size(), i + 1 + window);

            String value = null;
            String range = null;
            List<String> rangeParts = new ArrayList<>(2);
            int next = i + 1;
            int j = i + 1;
            for (; j < end; j++) {
                String current = fragments.get(j);
                if (FragmentShapes.isDateContaminated(current)) {
                    continue;
                }
                if (isAnchor(current)) {
                    break;
                }
                if (value == null) {
                    int consumed = combineValue(fragments, j, end);
                    if (consumed > 0) {
                        value = joinValue(fragments, j, consumed);
                        j += consumed - 1;
                        continue;
                    }
                }
                if (range == null && FragmentShapes.isRange(current)) {
                    range = FragmentShapes.rangeText(current);
                } else if (range == null && FragmentShapes.isBareNumber(current) && rangeParts.size() < 2) {
                    rangeParts.add(current);
                }
                if (value != null && (range != null || rangeParts.size() == 2)) {
                    j++;
                    break;
                }
            }
            next = j;

            if (value != null) {
                if (range == null && rangeParts.size() == 2) {
                    range = rangeParts.get(0) + " - " + rangeParts.get(1);
                }
                String line = range == null
                        ? anchor + ": " + value
                        : anchor + ": " + value + " (норма: " + range + ")";
                lines.add(line);
                log.debug("Reconstructed '{}' from fragments {}..{}", line, i, next - 1);
            }
            i = Math.max(i + 1, next);
        }
        return lines;
    }

    private static boolean isAnchor(String fragment) {
        return FragmentShapes.isTestName(fragment)
                && !FragmentShapes.isLabelledLine(fragment)
                && !FragmentShapes.isValue(fragment);
    }

    /**
     * @return number of fragments forming a value starting at {@code start}, 0 when none does
     */
    private static int combineValue(List<String> fragments, int start, int end) {
        String combined = fragments.get(start);
        if (FragmentShapes.isValue(combined)) {
            return 1;
        }
        if (!FragmentShapes.isBareNumber(combined)) {
            return 0;
        }
        int count = 1;
        for (int k = start + 1; k < Math.min(end, start + 1 + CONTINUATION_LOOKAHEAD); k++) {
            String next = fragments.get(k);
            if (FragmentShapes.isExponent(next)) {
                combined = combined + " " + next;
                count++;
            } else if (FragmentShapes.isUnitOnly(next) && !FragmentShapes.isTestName(next)) {
                combined = combined + " " + next;
                count++;
                break;
            } else {
                break;
            }
        }
        return count > 1 && FragmentShapes.isValue(combined) ? count : 0;
    }

    private static String joinValue(List<String> fragments, int start, int count) {
        return String.join(" ", fragments.subList(start, start + count));
    }
}

package com.eainde.labreport.proximity;

import com.eainde.labreport.parse.UnitCleaner;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reconstructs rows of a biochemistry table where marker, value with unit and
 * range arrive as separate fragments. Each marker is emitted at most once.
 */
@Log4j2
public class BiochemicalPanelReconstructor implements FragmentReconstructor {

    private static final int SHORT_MARKER = 5;
    private static final Map<String, String> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put("альбумин", "Альбумин");
        MARKERS.put("креатинин", "Креатинин");
        MARKERS.put("глюкоза", "Глюкоза");
        MARKERS.put("магний", "Магний");
        MARKERS.put("алт", "АЛТ");
        MARKERS.put("аст", "АСТ");
        MARKERS.put("ггт", "ГГТ");
        MARKERS.put("ггтп", "ГГТ");
        MARKERS.put("щелочная фосфатаза", "Щелочная фосфатаза");
        MARKERS.put("щелочная", "Щелочная фосфатаза");
        MARKERS.put("фосфатаза", "Щелочная фосфатаза");
        MARKERS.put("щф", "Щелочная фосфатаза");
        MARKERS.put("триглицериды", "Триглицериды");
        MARKERS.put("калий", "Калий");
        MARKERS.put("кальций", "Кальций");
        MARKERS.put("натрий", "Натрий");
        MARKERS.put("холестерин общий", "Холестерин общий");
        MARKERS.put("холестерин лпнп", "Холестерин ЛПНП");
        MARKERS.put("холестерин лпвп", "Холестерин ЛПВП");
        MARKERS.put("холестерин лпонп", "Холестерин ЛПОНП");
        MARKERS.put("холестерин", "Холестерин общий");
        MARKERS.put("лпнп", "Холестерин ЛПНП");
        MARKERS.put("лпвп", "Холестерин ЛПВП");
        MARKERS.put("лпонп", "Холестерин ЛПОНП");
        MARKERS.put("мочевина", "Мочевина");
        MARKERS.put("мочевая кислота", "Мочевая кислота");
        MARKERS.put("альфа-амилаза", "Альфа-амилаза");
        MARKERS.put("амилаза", "Амилаза");
    }

    /** Marker patterns, longest first, anchored at a word start. */
    private static final List<Map.Entry<Pattern, String>> MARKER_PATTERNS = MARKERS.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
            .map(e -> Map.entry(markerPattern(e.getKey()), e.getValue()))
            .toList();

    private static final Pattern VALUE_WITH_UNIT = Pattern.compile("(\\d+[,.]?\\d*)\\s*("
            + "U/L|МЕ/л|Ед/л|мкМЕ/мл|нг/мл|пг/мл|нг/дл|мг/л|мкг/л|сек|ммоль/л|мкмоль/л"
            + "|[а-яА-ЯёЁa-zA-Z/%×·*^]+(?:/[а-яА-ЯёЁa-zA-Z]+)?)");

    private final int window;

    public BiochemicalPanelReconstructor(int window) {
        this.window = window;
    }

    @Override
    public String name() {
        return "biochemical-panel";
    }

    @Override
    public List<String> reconstruct(List<String> fragments) {
        List<String> lines = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        int i = 0;
        while (i < fragments.size()) {
            String anchor = fragments.get(i);
            if (FragmentShapes.isDateContaminated(anchor) || FragmentShapes.isLabelledLine(anchor)) {
                i++;
                continue;
            }
            Optional<String> marker = marker(anchor);
            if (marker.isEmpty() || emitted.contains(marker.get())) {
                i++;
                continue;
            }
            String value = null;
            String range = null;
            int j = i;
            int end = Math.min(fragments.size(), i + window);
            for (; j < end; j++) {
                String current = fragments.get(j);
                if (j > i && marker(current).isPresent()) {
                    break;
                }
                if (FragmentShapes.isDateContaminated(current)) {
                    continue;
                }
                Matcher v = VALUE_WITH_UNIT.matcher(current);
                if (value == null && v.find()) {
                    value = v.group(1) + " " + UnitCleaner.clean(v.group(2));
                }
                if (range == null) {
                    range = FragmentShapes.rangeText(current);
                }
            }
            if (value != null) {
                emitted.add(marker.get());
                String line = range == null
                        ? marker.get() + ": " + value
                        : marker.get() + ": " + value + " (норма: " + range + ")";
                lines.add(line);
                log.debug("Reconstructed panel row: {}", line);
            }
            i = Math.max(i + 1, j);
        }
        return lines;
    }

    private static Pattern markerPattern(String marker) {
        // Abbreviations must end at a word boundary too: "аст" is not "астана".
        String tail = marker.length() <= SHORT_MARKER ? "(?![а-яёa-z])" : "";
        return Pattern.compile("(?<![а-яёa-z])" + Pattern.quote(marker) + tail);
    }

    private static Optional<String> marker(String fragment) {
        String lower = fragment.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> entry : MARKER_PATTERNS) {
            if (entry.getKey().matcher(lower).find()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}

package com.eainde.labreport.parse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repairs unit tokens where OCR dropped the slash or misread a letter
 * ({@code ммольл}, {@code ммолыл}, {@code гл}, ...).
 */
public final class UnitCleaner {

    private static final Map<String, String> REPLACEMENTS = new LinkedHashMap<>();

    static {
        REPLACEMENTS.put("ммольл", "ммоль/л");
        REPLACEMENTS.put("мкмольл", "мкмоль/л");
        REPLACEMENTS.put("ммолыл", "ммоль/л");
        REPLACEMENTS.put("мкмолыл", "мкмоль/л");
        REPLACEMENTS.put("гл", "г/л");
        REPLACEMENTS.put("мгл", "мг/л");
        REPLACEMENTS.put("мкгл", "мкг/л");
        REPLACEMENTS.put("едл", "Ед/л");
    }

    private UnitCleaner() {
    }

    public static String clean(String unit) {
        String cleaned = unit.strip();
        for (Map.Entry<String, String> r : REPLACEMENTS.entrySet()) {
            if (cleaned.contains(r.getKey())) {
                cleaned = cleaned.replace(r.getKey(), r.getValue());
            }
        }
        return cleaned;
    }
}

package com.eainde.labreport.profile;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of known report layouts. Detection returns the first profile whose
 * indicators match; new layouts are added here without touching the pipeline.
 */
@Log4j2
@Component
public class DocumentProfiles {

    public static final DocumentProfile KAZAKH_BIOCHEMISTRY = new DocumentProfile(
            "kazakh-biochemistry",
            List.of("Казакстан Республикасы", "Денсаулык сактау", "Каннын биохимиялык талдауы",
                    "Калыпты мелшер", "Нэтиже", "Компоненттер", "Аланинаминотрансфераза",
                    "Аспартатаминотрасфераза", "Едол", "Едал", "ммолыл", "мкмолыл"),
            3,
            List.of("министр", "буйрыг", "нысан", "форма", "приказ", "архимед", "archimedes",
                    "медицинская документация", "кужаттама", "организация", "отделение"),
            List.of("аланин", "аспартат", "амилаза", "фосфатаза", "глютамил", "глюкоза",
                    "билирубин", "компонент", "результат", "нэтиже", "калыпты",
                    "ед", "ммол", "мкмол", "алт", "аст", "щф", "ггт"),
            List.of(
                    new ExpectedMetric("alt_alanine_aminotransferase",
                            List.of("Аланинаминотрансфераза", "АЛТ"), "3 - 45"),
                    new ExpectedMetric("ast_aspartate_aminotransferase",
                            List.of("Аспартатаминотрасфераза", "Аспартатаминотрансфераза", "АСТ"), "0 - 35"),
                    new ExpectedMetric("alpha_amylase",
                            List.of("Альфа-амилаза", "Амилаза"), "25 - 125"),
                    new ExpectedMetric("alkaline_phosphatase",
                            List.of("Щелочная фосфатаза", "ЩФ"), "45 - 125"),
                    new ExpectedMetric("gamma_glutamyl_transferase",
                            List.of("Гаммаглютамилтрансфераза", "ГГТП"), "11 - 61"),
                    new ExpectedMetric("glucose",
                            List.of("Глюкоза", "сахар крови"), "3.05 - 6.4"),
                    new ExpectedMetric("total_bilirubin",
                            List.of("Билирубин общий", "Билирубин"), "< 22.0")),
            kazakhUnitCorrections(),
            "Ед/л");

    private final List<DocumentProfile> profiles;

    public DocumentProfiles() {
        this(List.of(KAZAKH_BIOCHEMISTRY));
    }

    public DocumentProfiles(List<DocumentProfile> profiles) {
        this.profiles = List.copyOf(profiles);
    }

    public Optional<DocumentProfile> detect(List<String> fragments) {
        for (DocumentProfile profile : profiles) {
            int matches = profile.indicatorMatches(fragments);
            if (matches >= profile.minMatches()) {
                log.info("Page matches document profile '{}' ({} indicators)", profile.id(), matches);
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    public Optional<DocumentProfile> byId(String id) {
        return profiles.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    private static Map<String, String> kazakhUnitCorrections() {
        Map<String, String> corrections = new LinkedHashMap<>();
        corrections.put("мкмолыл", "мкмоль/л");
        corrections.put("мкмол/л", "мкмоль/л");
        corrections.put("mkmoл/л", "мкмоль/л");
        corrections.put("ммолыл", "ммоль/л");
        corrections.put("ммол/л", "ммоль/л");
        corrections.put("ммоль/л", "ммоль/л");
        corrections.put("едол", "Ед/л");
        corrections.put("едал", "Ед/л");
        corrections.put("ед/л", "Ед/л");
        corrections.put("мгидл", "мг/дл");
        corrections.put("мкг/л", "мкг/л");
        corrections.put("мг/л", "мг/л");
        corrections.put("г/л", "г/л");
        return corrections;
    }
}

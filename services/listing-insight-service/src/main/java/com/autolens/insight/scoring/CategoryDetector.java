package com.autolens.insight.scoring;

import com.autolens.insight.market.VehicleCategory;
import com.autolens.insight.resolver.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Body category from the model name, by whole-word keyword. First category in table order wins. */
public final class CategoryDetector {
    private static final Map<VehicleCategory, List<Pattern>> KEYWORDS = compile();

    private CategoryDetector() {
    }

    public static VehicleCategory detect(String model) {
        String normalized = TextNormalizer.normalize(model);
        if (normalized.isEmpty()) {
            return VehicleCategory.UNKNOWN;
        }
        for (Map.Entry<VehicleCategory, List<Pattern>> entry : KEYWORDS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(normalized).find()) {
                    return entry.getKey();
                }
            }
        }
        return VehicleCategory.UNKNOWN;
    }

    private static Map<VehicleCategory, List<Pattern>> compile() {
        Map<VehicleCategory, List<String>> table = new LinkedHashMap<>();
        table.put(VehicleCategory.A, List.of("108", "c1", "up", "twingo", "aygo", "i10", "picanto", "spring"));
        table.put(VehicleCategory.B, List.of("208", "clio", "polo", "ibiza", "corsa", "fiesta", "yaris", "c3", "sandero", "zoe"));
        table.put(VehicleCategory.B_SUV, List.of("2008", "captur", "t-cross", "juke", "mokka", "duster"));
        table.put(VehicleCategory.C, List.of("308", "golf", "leon", "focus", "megane", "astra", "c4", "serie 1", "classe a", "a3"));
        table.put(VehicleCategory.C_SUV, List.of("3008", "tiguan", "tucson", "qashqai", "kadjar", "austral", "sportage", "model y"));
        table.put(VehicleCategory.D, List.of("508", "passat", "talisman", "mondeo", "mazda6", "serie 3", "classe c", "a4", "model 3"));
        table.put(VehicleCategory.D_SUV, List.of("5008", "touareg", "sorento", "kodiaq", "x5", "q7"));
        table.put(VehicleCategory.E, List.of("serie 5", "classe e", "a6", "s90", "model s"));
        table.put(VehicleCategory.F, List.of("serie 7", "classe s", "a8", "panamera"));
        table.put(VehicleCategory.MPV, List.of("scenic", "espace", "rifter", "touran", "picasso", "berlingo", "sharan"));
        table.put(VehicleCategory.LCV, List.of("expert", "trafic", "kangoo", "transit", "partner", "master", "jumpy"));

        Map<VehicleCategory, List<Pattern>> compiled = new LinkedHashMap<>();
        for (Map.Entry<VehicleCategory, List<String>> entry : table.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String keyword : entry.getValue()) {
                patterns.add(Pattern.compile("\\b" + Pattern.quote(TextNormalizer.normalize(keyword)) + "\\b"));
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }
}

package com.autolens.insight.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only surface forms used by {@link ListingResolver}. Keyword lists are normalized with
 * {@link TextNormalizer} when the tables are built so that they match the normalized listing text.
 */
public final class ListingVocabulary {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    static final List<Pattern> POWER_PATTERNS = List.of(
        Pattern.compile("\\b(\\d{2,3})\\s*(?:ch|cv|hp|din)\\b", FLAGS),
        Pattern.compile("\\b(\\d{2,3})\\s*chevaux\\b", FLAGS),
        Pattern.compile("\\bdin\\s*(\\d{2,3})\\b", FLAGS),
        Pattern.compile(
            "\\b(?:hdi|tdi|dci|tce|puretech|thp|vti|e-hdi|blue\\s*hdi|bluehdi)\\s*(\\d{2,3})\\b",
            FLAGS
        )
    );

    private static final String DATE_WORDS = "(?:année|annee|de|du|en)";

    // Ordered by trust: index 0 wins over 1, which wins over 2.
    static final List<Pattern> YEAR_PATTERNS = List.of(
        Pattern.compile("(?<!\\b" + DATE_WORDS + "\\s{0,4})(?<!\\d[/-])\\b(20[0-2][0-9])\\b", FLAGS),
        Pattern.compile("\\b" + DATE_WORDS + "\\s*(20[0-2][0-9])\\b", FLAGS),
        Pattern.compile("\\b\\d{1,2}[/-](20[0-2][0-9])\\b", FLAGS)
    );

    static final List<FuelType> FUEL_PRIORITY = List.of(
        FuelType.ELECTRIC,
        FuelType.PLUG_IN_HYBRID,
        FuelType.HYBRID,
        FuelType.CNG,
        FuelType.LPG,
        FuelType.DIESEL,
        FuelType.PETROL
    );

    private static final Map<String, List<String>> BRAND_ALIASES = buildBrandAliases();
    private static final Map<String, List<Pattern>> BRAND_PATTERNS = compileBrandPatterns(BRAND_ALIASES);
    private static final Map<GearboxType, List<Pattern>> GEARBOX_PATTERNS = compileGearboxPatterns();
    private static final Map<FuelType, List<Pattern>> FUEL_PATTERNS = compileFuelPatterns();

    private ListingVocabulary() {
    }

    // canonical brand name to raw aliases, in lookup order
    private static Map<String, List<String>> buildBrandAliases() {
        Map<String, List<String>> brands = new LinkedHashMap<>();
        brands.put("Peugeot", List.of("peugeot", "peugeo"));
        brands.put("Renault", List.of("renault", "renaul"));
        brands.put("Citroen", List.of("citroen", "citroën"));
        brands.put("Volkswagen", List.of("volkswagen", "vw", "volks"));
        brands.put("Audi", List.of("audi"));
        brands.put("BMW", List.of("bmw"));
        brands.put("Mercedes", List.of("mercedes", "mercedes-benz", "mb"));
        brands.put("Toyota", List.of("toyota"));
        brands.put("Ford", List.of("ford"));
        brands.put("Opel", List.of("opel"));
        brands.put("Fiat", List.of("fiat"));
        brands.put("Nissan", List.of("nissan"));
        brands.put("Hyundai", List.of("hyundai"));
        brands.put("Kia", List.of("kia"));
        brands.put("Seat", List.of("seat"));
        brands.put("Skoda", List.of("skoda", "škoda"));
        brands.put("Dacia", List.of("dacia"));
        brands.put("Mini", List.of("mini"));
        brands.put("Volvo", List.of("volvo"));
        brands.put("Mazda", List.of("mazda"));
        brands.put("Honda", List.of("honda"));
        brands.put("Suzuki", List.of("suzuki"));
        brands.put("Jeep", List.of("jeep"));
        brands.put("Land Rover", List.of("land rover", "landrover"));
        brands.put("Jaguar", List.of("jaguar"));
        brands.put("Porsche", List.of("porsche"));
        brands.put("Tesla", List.of("tesla"));
        brands.put("Lexus", List.of("lexus"));
        brands.put("Alfa Romeo", List.of("alfa romeo", "alfa"));
        brands.put("DS", List.of("ds automobiles", "ds"));
        return Collections.unmodifiableMap(brands);
    }

    static Map<String, List<Pattern>> brandPatterns() {
        return BRAND_PATTERNS;
    }

    static List<String> aliasesOf(String brand) {
        return BRAND_ALIASES.getOrDefault(brand, List.of());
    }

    static Map<GearboxType, List<Pattern>> gearboxPatterns() {
        return GEARBOX_PATTERNS;
    }

    static Map<FuelType, List<Pattern>> fuelPatterns() {
        return FUEL_PATTERNS;
    }

    private static Map<String, List<Pattern>> compileBrandPatterns(Map<String, List<String>> brands) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : brands.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String alias : normalizedDistinct(entry.getValue())) {
                patterns.add(Pattern.compile("\\b" + Pattern.quote(alias) + "\\b", FLAGS));
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }

    private static Map<GearboxType, List<Pattern>> compileGearboxPatterns() {
        Map<GearboxType, List<String>> keywords = new EnumMap<>(GearboxType.class);
        keywords.put(GearboxType.AUTOMATIC, List.of(
            "automatique", "auto", "bva", "bva6", "bva7", "bva8",
            "dsg", "dct", "dkg", "s-tronic", "stronic", "tiptronic",
            "eat6", "eat8", "edc", "edg", "cvt", "e-cvt",
            "powershift", "speedshift", "quickshift",
            "robotisée", "robotisee", "pilotée", "pilotee",
            "aisin", "at"
        ));
        keywords.put(GearboxType.MANUAL, List.of(
            "manuelle", "manuel", "bvm", "bvm5", "bvm6",
            "mécanique", "mecanique", "5 vitesses", "6 vitesses",
            "5v", "6v", "mt"
        ));
        Map<GearboxType, List<Pattern>> compiled = new EnumMap<>(GearboxType.class);
        for (Map.Entry<GearboxType, List<String>> entry : keywords.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String keyword : normalizedDistinct(entry.getValue())) {
                patterns.add(Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", FLAGS));
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }

    private static Map<FuelType, List<Pattern>> compileFuelPatterns() {
        Map<FuelType, List<String>> keywords = new EnumMap<>(FuelType.class);
        keywords.put(FuelType.DIESEL, List.of(
            "diesel", "gazole", "gasoil",
            "hdi", "bluehdi", "blue hdi", "blue-hdi",
            "tdi", "dci", "cdti", "crdi", "dtec", "d4d",
            "jtd", "jtdm", "mjt", "mjtd", "multijet",
            "tdci", "ddis", "i-dtec", "skyactiv-d",
            "116d", "118d", "120d", "125d",
            "216d", "218d", "220d", "225d",
            "316d", "318d", "320d", "325d", "330d", "335d", "340d",
            "418d", "420d", "425d", "430d", "435d", "440d",
            "518d", "520d", "525d", "530d", "535d", "540d",
            "630d", "640d",
            "725d", "730d", "740d", "750d",
            "x1 18d", "x1 20d", "x2 18d", "x2 20d",
            "x3 20d", "x3 30d", "x4 20d", "x4 30d",
            "x5 25d", "x5 30d", "x5 40d", "x6 30d", "x6 40d",
            "180d", "200d", "250d", "300d", "350d", "400d"
        ));
        keywords.put(FuelType.PETROL, List.of(
            "essence", "sp95", "sp98", "sans plomb", "e10", "e85",
            "tce", "puretech", "thp", "vti", "vvt", "vvti",
            "tfsi", "tsi", "fsi", "gti", "turbo essence",
            "mpi", "mivec", "vtec", "i-vtec", "skyactiv-g",
            "ecoboost", "ecotec", "duratec", "zetec"
        ));
        keywords.put(FuelType.HYBRID, List.of(
            "hybride", "hybrid", "hev", "mhev", "mild hybrid",
            "micro-hybride", "micro hybride",
            "e-tech", "etech"
        ));
        keywords.put(FuelType.PLUG_IN_HYBRID, List.of(
            "hybride rechargeable", "plug-in", "plugin", "phev",
            "rechargeable", "plug in hybrid",
            "t8", "p400e", "330e", "530e", "gla 250e"
        ));
        keywords.put(FuelType.ELECTRIC, List.of(
            "électrique", "electrique", "electric", "ev", "bev",
            "100% électrique", "100% electrique", "full electric",
            "e-208", "e-2008", "e-c4", "e-tron", "id.3", "id.4",
            "zoe", "leaf", "model 3", "model s", "model x", "model y",
            "kona ev", "niro ev", "ioniq", "mach-e"
        ));
        keywords.put(FuelType.LPG, List.of("gpl", "lpg", "bifuel", "bi-fuel"));
        keywords.put(FuelType.CNG, List.of("gnv", "cng", "gaz naturel", "tgi"));

        Map<FuelType, List<Pattern>> compiled = new EnumMap<>(FuelType.class);
        for (Map.Entry<FuelType, List<String>> entry : keywords.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String keyword : normalizedDistinct(entry.getValue())) {
                // whitespace-anchored literal: "ev" must not fire inside "elevee"
                patterns.add(Pattern.compile("(?<![^\\s-])" + Pattern.quote(keyword) + "(?![^\\s-])", FLAGS));
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }

    private static List<String> normalizedDistinct(List<String> values) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String value : values) {
            String normalized = TextNormalizer.normalize(value);
            if (!normalized.isEmpty()) {
                distinct.add(normalized);
            }
        }
        return List.copyOf(distinct);
    }
}

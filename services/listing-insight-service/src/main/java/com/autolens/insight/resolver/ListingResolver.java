package com.autolens.insight.resolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a listing title and description into {@link VehicleFeatures} and catalog projections.
 * Instances are cheap, hold no shared state and are safe to use from several threads.
 */
public class ListingResolver {
    private static final int RAW_TEXT_LIMIT = 200;
    private static final Pattern MODEL_TOKEN = Pattern.compile("[a-zA-Z0-9\\-]+");
    private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");

    private final String rawTitle;
    private final String normalizedText;
    private volatile VehicleFeatures features;

    public ListingResolver(String title, String description) {
        if (title == null || title.trim().isEmpty()) {
            throw new InvalidListingException("listing title is required");
        }
        this.rawTitle = title;
        this.normalizedText = TextNormalizer.normalize(title + " " + (description == null ? "" : description));
    }

    public ListingResolver(String title) {
        this(title, null);
    }

    public static VehicleFeatures resolve(String title, String description) {
        return new ListingResolver(title, description).extractFeatures();
    }

    public String extractBrand() {
        return extractBrand(normalizedText);
    }

    public String extractBrand(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, List<Pattern>> entry : ListingVocabulary.brandPatterns().entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    public String extractModel() {
        return extractModel(rawTitle);
    }

    /**
     * Takes the token right after a brand alias. This is a heuristic: purely numeric names such as
     * {@code 3008} are rejected and trim words can be picked up instead of a model name.
     */
    public String extractModel(String text) {
        String brand = extractBrand();
        if (brand == null || text == null) {
            return null;
        }
        for (String alias : ListingVocabulary.aliasesOf(brand)) {
            Pattern pattern = Pattern.compile(
                "\\b" + Pattern.quote(alias) + "\\s+(" + MODEL_TOKEN.pattern() + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS
            );
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String model = matcher.group(1);
                if (model.length() >= 2 && !DIGITS_ONLY.matcher(model).matches()) {
                    return model.toUpperCase(Locale.ROOT);
                }
            }
        }
        return null;
    }

    public Integer extractPower() {
        return extractPower(normalizedText);
    }

    public Integer extractPower(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (Pattern pattern : ListingVocabulary.POWER_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Integer power = parseInt(matcher.group(1));
                if (VehicleFeatures.isValidPower(power)) {
                    counts.merge(power, 1, Integer::sum);
                }
            }
        }
        // most frequent value; on a tie the first one seen
        Integer best = null;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public Integer extractYear() {
        return extractYear(normalizedText);
    }

    public Integer extractYear(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        List<Pattern> patterns = ListingVocabulary.YEAR_PATTERNS;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Integer year = parseInt(matcher.group(1));
                if (VehicleFeatures.isValidYear(year)) {
                    return year;
                }
            }
        }
        return null;
    }

    public GearboxType extractGearbox() {
        return extractGearbox(normalizedText);
    }

    public GearboxType extractGearbox(String text) {
        if (text == null || text.isEmpty()) {
            return GearboxType.UNKNOWN;
        }
        int automatic = countHits(ListingVocabulary.gearboxPatterns().get(GearboxType.AUTOMATIC), text);
        int manual = countHits(ListingVocabulary.gearboxPatterns().get(GearboxType.MANUAL), text);
        if (automatic > manual) {
            return GearboxType.AUTOMATIC;
        }
        if (manual > automatic) {
            return GearboxType.MANUAL;
        }
        return GearboxType.UNKNOWN;
    }

    public FuelType extractFuel() {
        return extractFuel(normalizedText);
    }

    /**
     * Rarer fuels are more decisive than generic mentions: the first type of the priority order with
     * at least one hit wins, whatever the hit counts of the others.
     */
    public FuelType extractFuel(String text) {
        if (text == null || text.isEmpty()) {
            return FuelType.UNKNOWN;
        }
        Map<FuelType, List<Pattern>> patterns = ListingVocabulary.fuelPatterns();
        for (FuelType fuel : ListingVocabulary.FUEL_PRIORITY) {
            if (countHits(patterns.get(fuel), text) > 0) {
                return fuel;
            }
        }
        return FuelType.UNKNOWN;
    }

    public VehicleFeatures extractFeatures() {
        VehicleFeatures current = features;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (features == null) {
                features = new VehicleFeatures(
                    extractPower(),
                    extractYear(),
                    extractGearbox(),
                    extractFuel(),
                    normalizedText.length() > RAW_TEXT_LIMIT
                        ? normalizedText.substring(0, RAW_TEXT_LIMIT)
                        : normalizedText
                );
            }
            return features;
        }
    }

    public CatalogQuery catalogQuery() {
        VehicleFeatures extracted = extractFeatures();
        Map<String, Double> confidence = new LinkedHashMap<>();

        String brand = extractBrand();
        if (brand != null) {
            confidence.put("brand", 1.0);
        }
        String model = extractModel();
        if (model != null) {
            confidence.put("model", 0.9);
        }
        IntRange powerRange = null;
        if (extracted.powerHp() != null) {
            powerRange = IntRange.around(extracted.powerHp(), CatalogQuery.POWER_TOLERANCE_HP);
            confidence.put("power", 1.0);
        }
        FuelType fuel = null;
        if (extracted.fuel() != FuelType.UNKNOWN) {
            fuel = extracted.fuel();
            confidence.put("fuel", 1.0);
        }
        GearboxType gearbox = null;
        if (extracted.gearbox() != GearboxType.UNKNOWN) {
            gearbox = extracted.gearbox();
            confidence.put("gearbox", 0.8);
        }
        YearWindow yearWindow = null;
        if (extracted.year() != null) {
            yearWindow = YearWindow.around(extracted.year(), CatalogQuery.YEAR_TOLERANCE);
            confidence.put("year", 1.0);
        }

        double total = 0.0;
        for (double weight : confidence.values()) {
            total += weight;
        }
        double overall = round2(total / Math.max(confidence.size(), 1));
        return new CatalogQuery(brand, model, powerRange, fuel, gearbox, yearWindow, confidence, overall, extracted);
    }

    public ReferenceQuery referenceQuery() {
        VehicleFeatures extracted = extractFeatures();
        String brand = extractBrand();
        IntRange powerKw = null;
        if (extracted.powerHp() != null) {
            powerKw = IntRange.around(
                ReferenceQuery.toKilowatts(extracted.powerHp()),
                ReferenceQuery.POWER_TOLERANCE_KW
            );
        }
        List<String> fuelCodes = extracted.fuel() == FuelType.UNKNOWN
            ? null
            : ReferenceQuery.fuelCodesFor(extracted.fuel());
        return new ReferenceQuery(
            brand == null ? null : brand.toUpperCase(Locale.ROOT),
            powerKw,
            fuelCodes,
            extracted
        );
    }

    private static int countHits(List<Pattern> patterns, String text) {
        if (patterns == null) {
            return 0;
        }
        int hits = 0;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                hits++;
            }
        }
        return hits;
    }

    private static Integer parseInt(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    @Override
    public String toString() {
        String head = rawTitle.length() > 50 ? rawTitle.substring(0, 50) + "..." : rawTitle;
        return "ListingResolver(title='" + head + "')";
    }
}

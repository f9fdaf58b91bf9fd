package com.autolens.insight.market;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

@Component
public class MarketTablesLoader {
    private static final Logger log = LoggerFactory.getLogger(MarketTablesLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    public MarketTables load(String path) {
        if (path == null || path.isBlank()) {
            log.warn("market tables path not configured");
            return MarketTables.empty("mt_missing");
        }
        Map<String, Object> root;
        try (InputStream input = open(path)) {
            if (input == null) {
                log.warn("market tables not found at {}", path);
                return MarketTables.empty("mt_missing");
            }
            Object parsed = new Yaml().load(input);
            if (!(parsed instanceof Map<?, ?> map)) {
                log.warn("market tables malformed (root not map)");
                return MarketTables.empty("mt_invalid");
            }
            root = (Map<String, Object>) map;
        } catch (Exception ex) {
            log.warn("market tables load failed", ex);
            return MarketTables.empty("mt_error");
        }
        return parse(root);
    }

    MarketTables parse(Map<String, Object> root) {
        String version = asString(root.get("version"), "v1");
        return new MarketTables(
            version,
            parseBrands(root.get("brands")),
            parseSegmentMapping(root.get("segment_mapping")),
            parseAliases(root.get("segment_aliases")),
            parseWeights(root.get("segment_weights"))
        );
    }

    private InputStream open(String path) throws Exception {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resource = path.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null) {
                loader = MarketTablesLoader.class.getClassLoader();
            }
            return loader.getResourceAsStream(resource);
        }
        Path resolved = resolvePath(path);
        if (!Files.exists(resolved)) {
            return null;
        }
        return Files.newInputStream(resolved);
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }

    private Map<String, BrandProfile> parseBrands(Object raw) {
        Map<String, BrandProfile> brands = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return brands;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = asString(entry.getKey(), null);
            if (key == null) {
                continue;
            }
            String name = key;
            String segment = null;
            if (entry.getValue() instanceof Map<?, ?> profile) {
                name = asString(profile.get("name"), key);
                segment = asString(profile.get("market_segment"), null);
            } else {
                segment = asString(entry.getValue(), null);
            }
            if (segment == null) {
                log.warn("brand {} has no market_segment, skipped", key);
                continue;
            }
            brands.put(key, new BrandProfile(key, name, segment));
        }
        return brands;
    }

    private Map<String, List<String>> parseSegmentMapping(Object raw) {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return mapping;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String segment = asString(entry.getKey(), null);
            if (segment == null || !(entry.getValue() instanceof List<?> list)) {
                continue;
            }
            List<String> brands = new ArrayList<>();
            for (Object item : list) {
                String brand = asString(item, null);
                if (brand != null) {
                    brands.add(brand);
                }
            }
            mapping.put(segment, brands);
        }
        return mapping;
    }

    private Map<String, String> parseAliases(Object raw) {
        Map<String, String> aliases = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) {
            return aliases;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String label = asString(entry.getKey(), null);
            String target = asString(entry.getValue(), null);
            if (label != null && target != null) {
                aliases.put(label, target);
            }
        }
        return aliases;
    }

    private Map<MarketSegment, SegmentWeights> parseWeights(Object raw) {
        Map<MarketSegment, SegmentWeights> weights = new EnumMap<>(MarketSegment.class);
        if (!(raw instanceof Map<?, ?> map)) {
            return weights;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String label = asString(entry.getKey(), null);
            MarketSegment segment = MarketSegment.fromKey(label).orElse(null);
            if (segment == null) {
                log.warn("segment_weights: unknown segment {}, skipped", label);
                continue;
            }
            if (!(entry.getValue() instanceof Map<?, ?> criteria)) {
                continue;
            }
            Map<Criterion, Double> values = new EnumMap<>(Criterion.class);
            for (Map.Entry<?, ?> weight : criteria.entrySet()) {
                String criterionName = asString(weight.getKey(), null);
                Criterion criterion = Criterion.fromKey(criterionName).orElse(null);
                Double value = asDouble(weight.getValue());
                if (criterion == null || value == null) {
                    log.warn("segment_weights.{}: ignored entry {}={}", label, criterionName, weight.getValue());
                    continue;
                }
                values.put(criterion, value);
            }
            weights.put(segment, new SegmentWeights(values));
        }
        return weights;
    }

    private String asString(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? fallback : value;
    }

    private Double asDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}

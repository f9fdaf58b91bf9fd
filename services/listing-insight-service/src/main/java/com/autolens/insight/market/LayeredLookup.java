package com.autolens.insight.market;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered chain of named lookup stages ending with a default. The first stage returning a value wins
 * and the resolution reports which stage produced it, so fallbacks can be audited.
 */
public final class LayeredLookup<K, V> {
    public static final String DEFAULT_STAGE = "default";

    private final List<Stage<K, V>> stages;
    private final V defaultValue;

    private LayeredLookup(List<Stage<K, V>> stages, V defaultValue) {
        this.stages = List.copyOf(stages);
        this.defaultValue = defaultValue;
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    public Resolution<V> resolve(K key) {
        for (Stage<K, V> stage : stages) {
            Optional<V> found = key == null ? Optional.empty() : stage.lookup().apply(key);
            if (found != null && found.isPresent()) {
                return new Resolution<>(found.get(), stage.name());
            }
        }
        return new Resolution<>(defaultValue, DEFAULT_STAGE);
    }

    public List<String> stageNames() {
        List<String> names = new ArrayList<>();
        for (Stage<K, V> stage : stages) {
            names.add(stage.name());
        }
        names.add(DEFAULT_STAGE);
        return names;
    }

    public record Resolution<V>(V value, String stage) {
        public boolean isDefault() {
            return DEFAULT_STAGE.equals(stage);
        }
    }

    private record Stage<K, V>(String name, Function<K, Optional<V>> lookup) {}

    public static final class Builder<K, V> {
        private final List<Stage<K, V>> stages = new ArrayList<>();

        private Builder() {
        }

        public Builder<K, V> stage(String name, Function<K, Optional<V>> lookup) {
            stages.add(new Stage<>(name, lookup));
            return this;
        }

        public LayeredLookup<K, V> orElse(V defaultValue) {
            return new LayeredLookup<>(stages, defaultValue);
        }
    }
}

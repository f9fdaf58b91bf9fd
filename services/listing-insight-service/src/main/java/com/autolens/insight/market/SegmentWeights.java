package com.autolens.insight.market;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class SegmentWeights {
    private static final SegmentWeights EMPTY = new SegmentWeights(Map.of());

    private final Map<Criterion, Double> weights;

    public SegmentWeights(Map<Criterion, Double> weights) {
        Map<Criterion, Double> copy = new EnumMap<>(Criterion.class);
        if (weights != null) {
            for (Map.Entry<Criterion, Double> entry : weights.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static SegmentWeights empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public boolean contains(Criterion criterion) {
        return weights.containsKey(criterion);
    }

    public double get(Criterion criterion) {
        return weights.getOrDefault(criterion, 0.0);
    }

    public double sum() {
        double total = 0.0;
        for (double weight : weights.values()) {
            total += weight;
        }
        return total;
    }

    /** Largest weights first; equal weights keep the criterion declaration order. */
    public List<Map.Entry<Criterion, Double>> dominant(int limit) {
        List<Map.Entry<Criterion, Double>> entries = new ArrayList<>();
        for (Map.Entry<Criterion, Double> entry : weights.entrySet()) {
            entries.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        entries.sort(Map.Entry.<Criterion, Double>comparingByValue(Comparator.reverseOrder()));
        return List.copyOf(entries.subList(0, Math.min(Math.max(limit, 0), entries.size())));
    }

    public Map<Criterion, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return "SegmentWeights" + weights;
    }
}

package com.trading.hedge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

/**
 * Result of a contract valuation as read from the result store: the base fair
 * value and the per-path values of every perturbed run, keyed by perturbation
 * key text (positive and negated).
 */
public final class ValuationResult {
    @Getter
    private final String id;
    @Getter
    private final FairValue fairValue;
    private final Map<String, double[]> perturbedValues;

    public ValuationResult(String id, FairValue fairValue, Map<String, double[]> perturbedValues) {
        if (fairValue == null) {
            throw new IllegalArgumentException("Fair value is required for result " + id);
        }
        this.id = id;
        this.fairValue = fairValue;
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : perturbedValues.entrySet()) {
            copy.put(e.getKey(), e.getValue().clone());
        }
        this.perturbedValues = Collections.unmodifiableMap(copy);
    }

    /** All perturbation key texts, positive and negated. */
    public Set<String> perturbedKeys() {
        return perturbedValues.keySet();
    }

    /**
     * Returns a copy of the per-path values of a key, checking presence and
     * length.
     *
     * @throws IllegalStateException if the key is missing or has the wrong
     *                               number of paths.
     */
    public double[] requirePerturbedValue(String keyText, int pathCount) {
        double[] values = perturbedValues.get(keyText);
        if (values == null) {
            throw new IllegalStateException("Result " + id + " has no perturbed value for '" + keyText + "'");
        }
        if (values.length != pathCount) {
            throw new IllegalStateException("Perturbed value '" + keyText + "' has " + values.length
                    + " paths, expected " + pathCount);
        }
        return values.clone();
    }
}

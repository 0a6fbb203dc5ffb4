package com.ivirs.backend.service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-vehicle trust score in [0, 1].
 *
 * <p>Entries start at {@value #DEFAULT_SCORE} on first reference and are never removed, so
 * reputation survives a vehicle leaving and re-entering the feed. Each update is a single
 * atomic read-modify-write on its key.
 */
public class ReputationStore {

    public static final double DEFAULT_SCORE = 0.5;
    public static final double REWARD = 0.1;
    public static final double PENALTY = 0.3;

    private final Map<String, Double> scores = new ConcurrentHashMap<>();

    /** Current score, creating the default entry if the vehicle is new. */
    public double get(String vehicleId) {
        return scores.computeIfAbsent(vehicleId, id -> DEFAULT_SCORE);
    }

    /** Current score without creating an entry. */
    public double peek(String vehicleId) {
        return scores.getOrDefault(vehicleId, DEFAULT_SCORE);
    }

    public double reward(String vehicleId) {
        return adjust(vehicleId, REWARD);
    }

    public double penalize(String vehicleId) {
        return adjust(vehicleId, -PENALTY);
    }

    /** Applies {@code delta} atomically and returns the clamped result. */
    public double adjust(String vehicleId, double delta) {
        return scores.compute(vehicleId, (id, current) ->
                clamp((current == null ? DEFAULT_SCORE : current) + delta));
    }

    public int size() {
        return scores.size();
    }

    public Map<String, Double> snapshot() {
        return new TreeMap<>(scores);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

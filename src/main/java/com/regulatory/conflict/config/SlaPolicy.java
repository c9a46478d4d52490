package com.regulatory.conflict.config;

import java.time.Duration;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Acknowledgement windows per escalation level, plus the stakeholder notified at each level.
 * Levels above the highest configured one reuse the highest configured entry.
 */
public final class SlaPolicy {

    private final NavigableMap<Integer, Duration> windows;
    private final NavigableMap<Integer, String> stakeholders;

    private SlaPolicy(NavigableMap<Integer, Duration> windows, NavigableMap<Integer, String> stakeholders) {
        this.windows = windows;
        this.stakeholders = stakeholders;
    }

    /**
     * @throws InvalidConfigurationException if levels do not start at 1 and run consecutively,
     *                                       or a window is not positive
     */
    public static SlaPolicy of(Map<Integer, Duration> windows, Map<Integer, String> stakeholders) {
        if (windows == null || windows.isEmpty()) {
            throw new InvalidConfigurationException("At least one SLA window is required");
        }
        TreeMap<Integer, Duration> sortedWindows = new TreeMap<>(windows);
        int expected = 1;
        for (Map.Entry<Integer, Duration> entry : sortedWindows.entrySet()) {
            if (entry.getKey() != expected) {
                throw new InvalidConfigurationException("SLA levels must be consecutive from 1, missing level " + expected);
            }
            if (entry.getValue() == null || entry.getValue().isNegative() || entry.getValue().isZero()) {
                throw new InvalidConfigurationException("SLA window for level " + entry.getKey() + " must be positive");
            }
            expected++;
        }
        TreeMap<Integer, String> sortedStakeholders = new TreeMap<>();
        if (stakeholders != null) {
            for (Map.Entry<Integer, String> entry : stakeholders.entrySet()) {
                if (entry.getKey() < 1 || entry.getValue() == null || entry.getValue().isBlank()) {
                    throw new InvalidConfigurationException("Invalid stakeholder mapping for level " + entry.getKey());
                }
                sortedStakeholders.put(entry.getKey(), entry.getValue());
            }
        }
        return new SlaPolicy(sortedWindows, sortedStakeholders);
    }

    /**
     * Default policy: 48h at level 1, 24h at level 2, 8h from level 3 on.
     */
    public static SlaPolicy defaults() {
        return of(
                Map.of(1, Duration.ofHours(48), 2, Duration.ofHours(24), 3, Duration.ofHours(8)),
                Map.of(1, "compliance-officer", 2, "legal-counsel", 3, "general-counsel"));
    }

    public Duration windowFor(int level) {
        Map.Entry<Integer, Duration> entry = windows.floorEntry(level);
        return entry != null ? entry.getValue() : windows.firstEntry().getValue();
    }

    /**
     * Returns the stakeholder for the level, falling back to the closest lower level,
     * or {@code null} if none is configured.
     */
    public String stakeholderFor(int level) {
        Map.Entry<Integer, String> entry = stakeholders.floorEntry(level);
        return entry != null ? entry.getValue() : null;
    }

    public int highestConfiguredLevel() {
        return windows.lastKey();
    }

    @Override
    public String toString() {
        return "SlaPolicy{windows=" + windows + ", stakeholders=" + stakeholders + '}';
    }
}

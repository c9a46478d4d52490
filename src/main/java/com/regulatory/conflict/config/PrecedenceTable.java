package com.regulatory.conflict.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered jurisdiction tiers used by Jurisdictional Arbitration, highest precedence first
 * (e.g. {@code treaty > EU > national}).
 *
 * <p>A jurisdiction tag belongs to a tier when it equals the tier or is nested under it
 * ({@code EU/FR} belongs to {@code EU}). Tiers must be distinct and must not nest inside one
 * another, otherwise the rank of a tag would be ambiguous.</p>
 */
public final class PrecedenceTable {

    private final List<String> tiers;

    private PrecedenceTable(List<String> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    /**
     * Creates a table from tiers ordered by decreasing precedence.
     *
     * @throws InvalidConfigurationException if a tier is blank, duplicated or nested in another
     */
    public static PrecedenceTable of(List<String> tiers) {
        Objects.requireNonNull(tiers, "tiers is required");
        Set<String> seen = new HashSet<>();
        List<String> normalized = new ArrayList<>();
        for (String tier : tiers) {
            if (tier == null || tier.isBlank()) {
                throw new InvalidConfigurationException("Precedence table contains a blank tier");
            }
            String trimmed = tier.trim();
            if (!seen.add(trimmed)) {
                throw new InvalidConfigurationException("Precedence table lists '" + trimmed + "' more than once");
            }
            normalized.add(trimmed);
        }
        for (String a : normalized) {
            for (String b : normalized) {
                if (!a.equals(b) && belongsTo(a, b)) {
                    throw new InvalidConfigurationException(
                            "Precedence tiers '" + a + "' and '" + b + "' overlap; rank would be ambiguous");
                }
            }
        }
        return new PrecedenceTable(normalized);
    }

    public static PrecedenceTable of(String... tiers) {
        return of(List.of(tiers));
    }

    public static PrecedenceTable empty() {
        return new PrecedenceTable(List.of());
    }

    public List<String> tiers() {
        return tiers;
    }

    public boolean isEmpty() {
        return tiers.isEmpty();
    }

    /**
     * Returns the best (lowest) rank among the given jurisdiction tags, or empty when none
     * of the tags is listed.
     */
    public OptionalInt rankOf(Set<String> jurisdiction) {
        int best = Integer.MAX_VALUE;
        for (String tag : jurisdiction) {
            for (int i = 0; i < tiers.size() && i < best; i++) {
                if (belongsTo(tag, tiers.get(i))) {
                    best = i;
                }
            }
        }
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    private static boolean belongsTo(String tag, String tier) {
        return tag.equals(tier) || tag.startsWith(tier + "/");
    }

    @Override
    public String toString() {
        return String.join(" > ", tiers);
    }
}

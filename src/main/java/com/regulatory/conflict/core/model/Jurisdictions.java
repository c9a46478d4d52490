package com.regulatory.conflict.core.model;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Operations on hierarchical jurisdiction tags such as {@code US/CA} or
 * {@code EU/DE/employers}. A tag covers itself and every tag below it.
 */
public final class Jurisdictions {

    public static final String SEPARATOR = "/";

    private Jurisdictions() {
    }

    /**
     * Returns whether {@code ancestor} equals {@code tag} or is one of its parent paths.
     */
    public static boolean covers(String ancestor, String tag) {
        return tag.equals(ancestor) || tag.startsWith(ancestor + SEPARATOR);
    }

    /**
     * Returns the overlap of two scopes: for each pair of related tags, the more specific one.
     */
    public static Set<String> intersect(Collection<String> a, Collection<String> b) {
        Set<String> result = new TreeSet<>();
        for (String left : a) {
            for (String right : b) {
                if (covers(left, right)) {
                    result.add(right);
                } else if (covers(right, left)) {
                    result.add(left);
                }
            }
        }
        return result;
    }

    /**
     * Returns whether every tag of {@code scope} is covered by {@code by}.
     */
    public static boolean isCoveredBy(Collection<String> scope, Collection<String> by) {
        if (scope.isEmpty()) {
            return false;
        }
        return scope.stream().allMatch(tag -> by.stream().anyMatch(outer -> covers(outer, tag)));
    }

    /**
     * Returns whether {@code narrower} is a strict subset of {@code broader}.
     */
    public static boolean isStrictlyNarrower(Collection<String> narrower, Collection<String> broader) {
        return isCoveredBy(narrower, broader) && !isCoveredBy(broader, narrower);
    }

    public static String topLevel(String tag) {
        int idx = tag.indexOf(SEPARATOR);
        return idx < 0 ? tag : tag.substring(0, idx);
    }
}

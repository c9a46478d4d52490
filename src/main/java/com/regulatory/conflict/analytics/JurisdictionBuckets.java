package com.regulatory.conflict.analytics;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Jurisdictions;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Maps a conflict to the coarse jurisdiction bucket its statistics are kept under:
 * the sorted top-level segments of the jurisdiction intersection joined with {@code +}
 * ({@code EU+US}), or {@code GLOBAL} when the intersection is empty.
 */
public final class JurisdictionBuckets {

    public static final String GLOBAL = "GLOBAL";

    private JurisdictionBuckets() {
    }

    public static String bucketOf(Conflict conflict) {
        return bucketOf(conflict.getEvidence().jurisdictionIntersection());
    }

    public static String bucketOf(Collection<String> jurisdictions) {
        if (jurisdictions == null || jurisdictions.isEmpty()) {
            return GLOBAL;
        }
        TreeSet<String> segments = new TreeSet<>();
        for (String tag : jurisdictions) {
            segments.add(Jurisdictions.topLevel(tag));
        }
        return String.join("+", segments);
    }
}

package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.PairKey;

/**
 * A check that could not run on a pair because a provision lacks a field it needs.
 */
public record DataQualityIssue(PairKey pair, ConflictType check, String reason) {
}

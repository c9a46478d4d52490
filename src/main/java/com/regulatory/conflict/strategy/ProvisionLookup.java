package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.Optional;

/**
 * Read access to the provisions of the current snapshot.
 */
@FunctionalInterface
public interface ProvisionLookup {

    Optional<NormativeProvision> find(String provisionId);
}

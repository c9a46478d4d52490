package com.regulatory.conflict.support;

import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.ObligationPolarity;

import java.time.LocalDate;

/**
 * Provision builders pre-filled with the fields most tests do not care about.
 */
public final class ProvisionFixtures {

    public static final LocalDate JAN_2020 = LocalDate.of(2020, 1, 1);
    public static final LocalDate JUN_2023 = LocalDate.of(2023, 6, 1);

    private ProvisionFixtures() {
    }

    public static NormativeProvision.Builder provision(String id, ObligationPolarity polarity) {
        return NormativeProvision.builder()
                .id(id)
                .frameworkId("fw-" + id)
                .polarity(polarity)
                .topicTags("data-breach")
                .jurisdiction("US")
                .authorityLevel(1)
                .effectiveDate(JAN_2020)
                .obligation(polarity.name().toLowerCase() + " " + id);
    }

    public static NormativeProvision.Builder requires(String id) {
        return provision(id, ObligationPolarity.REQUIRES);
    }

    public static NormativeProvision.Builder prohibits(String id) {
        return provision(id, ObligationPolarity.PROHIBITS);
    }

    public static NormativeProvision.Builder permits(String id) {
        return provision(id, ObligationPolarity.PERMITS);
    }
}

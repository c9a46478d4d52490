package com.regulatory.conflict.detection;

import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.SeverityWeights;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.NormativeProvision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static com.regulatory.conflict.support.ProvisionFixtures.prohibits;
import static com.regulatory.conflict.support.ProvisionFixtures.requires;
import static org.junit.jupiter.api.Assertions.*;

class SeverityCalculatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

    private final EngineConfig config = EngineConfig.builder().clock(CLOCK).build();

    private static double severity(SeverityCalculator calculator, NormativeProvision a, NormativeProvision b) {
        PairFacts facts = PairFacts.of(a, b);
        ConflictEvidence evidence = ConflictEvidence.builder()
                .jurisdictionIntersection(facts.jurisdictionIntersection())
                .overlap(facts.overlapStart(), facts.overlapEnd())
                .authorityGap(facts.authorityGap())
                .build();
        return calculator.severity(facts, evidence);
    }

    @Test
    @DisplayName("Should weight authority gap and urgency of a conflict already in force")
    void testInForce() {
        SeverityCalculator calculator = new SeverityCalculator(config, ReachEstimator.none());

        double severity = severity(calculator,
                prohibits("A").authorityLevel(2).build(), requires("B").authorityLevel(1).build());

        // 0.4 * (1 / 5) + 0.3 * 0 + 0.3 * 1
        assertEquals(0.38, severity, 1e-9);
    }

    @Test
    @DisplayName("Urgency decays linearly until the horizon")
    void testUrgencyDecay() {
        SeverityCalculator calculator = new SeverityCalculator(config, ReachEstimator.none());

        PairFacts soon = PairFacts.of(requires("A").effectiveDate(TODAY.plusDays(73)).build(), requires("B").build());
        PairFacts far = PairFacts.of(requires("A").effectiveDate(TODAY.plusDays(400)).build(), requires("B").build());

        assertEquals(0.8, calculator.urgency(soon), 1e-9);
        assertEquals(0.0, calculator.urgency(far), 1e-9);
    }

    @Test
    @DisplayName("Unknown dates count as fully urgent")
    void testUnknownDates() {
        SeverityCalculator calculator = new SeverityCalculator(config, ReachEstimator.none());
        PairFacts facts = PairFacts.of(requires("A").effectiveDate(null).build(), requires("B").effectiveDate(null).build());
        assertEquals(1.0, calculator.urgency(facts));
    }

    @Test
    @DisplayName("Should clamp reach and cap the gap at the authority scale")
    void testClamping() {
        EngineConfig reachOnly = config.toBuilder()
                .severityWeights(new SeverityWeights(0.5, 0.5, 0.0))
                .build();
        SeverityCalculator calculator = new SeverityCalculator(reachOnly, (a, b, scope) -> 7.0);

        double severity = severity(calculator,
                prohibits("A").authorityLevel(10).build(), requires("B").authorityLevel(1).build());

        assertEquals(1.0, severity, 1e-9);
    }

    @Test
    @DisplayName("Severity is the same whichever way round the pair is given")
    void testSymmetric() {
        SeverityCalculator calculator = new SeverityCalculator(config, (a, b, scope) -> 0.25);
        NormativeProvision a = prohibits("A").authorityLevel(3).effectiveDate(TODAY.plusDays(30)).build();
        NormativeProvision b = requires("B").authorityLevel(1).build();

        assertEquals(severity(calculator, a, b), severity(calculator, b, a));
    }
}

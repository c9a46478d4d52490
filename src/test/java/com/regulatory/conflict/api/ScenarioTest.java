package com.regulatory.conflict.api;

import com.regulatory.conflict.core.model.ConflictStatus;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.Quantity;
import com.regulatory.conflict.core.model.ResolutionRecord;
import com.regulatory.conflict.core.model.StrategyKind;
import com.regulatory.conflict.similarity.SimilarityScore;
import com.regulatory.conflict.similarity.SimilarityScorer;
import com.regulatory.conflict.strategy.ResolutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.regulatory.conflict.support.ProvisionFixtures.JUN_2023;
import static com.regulatory.conflict.support.ProvisionFixtures.permits;
import static com.regulatory.conflict.support.ProvisionFixtures.prohibits;
import static com.regulatory.conflict.support.ProvisionFixtures.requires;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end cycles over small provision sets, one typical regulatory situation each.
 */
class ScenarioTest {

    private static ConflictEngine engine(SimilarityScorer scorer) {
        return ConflictEngine.builder().similarityScorer(scorer).build();
    }

    private static ResolutionResult single(CycleReport report) {
        assertEquals(1, report.resolutions().size(), "expected exactly one resolution");
        return report.resolutions().get(0);
    }

    @Test
    @DisplayName("Federal prohibition overrides a state requirement by Lex Superior")
    void federalOverridesState() {
        NormativeProvision federal = prohibits("A").authorityLevel(2).build();
        NormativeProvision state = requires("B").jurisdiction("US/CA").authorityLevel(1).build();

        try (ConflictEngine engine = engine(SimilarityScorer.unavailable())) {
            CycleReport report = engine.runCycle(List.of(federal, state));

            assertEquals(1, report.detection().created().size());
            ResolutionResult result = single(report);
            assertEquals(ConflictType.HIERARCHICAL, result.conflict().getType());
            assertEquals(ConflictStatus.RESOLVED, result.conflict().getStatus());
            ResolutionRecord record = result.getRecord().orElseThrow();
            assertEquals(StrategyKind.LEX_SUPERIOR, record.strategy());
            assertEquals(Optional.of("A"), record.winner());
            assertEquals(0.93, record.confidence(), 1e-9);
        }
    }

    @Test
    @DisplayName("A later amendment supersedes an earlier rule by Lex Posterior")
    void laterAmendmentWins() {
        NormativeProvision original = requires("A").obligation("report breaches within 72 hours").build();
        NormativeProvision amendment = requires("B").effectiveDate(JUN_2023)
                .obligation("report breaches within 24 hours").build();

        try (ConflictEngine engine = engine(SimilarityScorer.unavailable())) {
            ResolutionResult result = single(engine.runCycle(List.of(original, amendment)));

            assertEquals(ConflictType.TEMPORAL, result.conflict().getType());
            ResolutionRecord record = result.getRecord().orElseThrow();
            assertEquals(StrategyKind.LEX_POSTERIOR, record.strategy());
            assertEquals(Optional.of("B"), record.winner());
            assertEquals(JUN_2023.toString(), record.parameters().get("effectiveFrom"));
        }
    }

    @Test
    @DisplayName("A rule for large employers is an exception to the general employer rule")
    void specialRuleCarvesOutException() {
        NormativeProvision general = requires("A").jurisdiction("US/employers").build();
        NormativeProvision special = prohibits("B").jurisdiction("US/employers/large").build();

        try (ConflictEngine engine = engine(SimilarityScorer.unavailable())) {
            ResolutionResult result = single(engine.runCycle(List.of(general, special)));

            assertEquals(ConflictType.JURISDICTIONAL, result.conflict().getType());
            ResolutionRecord record = result.getRecord().orElseThrow();
            assertEquals(StrategyKind.LEX_SPECIALIS, record.strategy());
            assertEquals(Optional.of("B"), record.winner());
            assertEquals(2, record.schedule().size());
            assertEquals("B", record.parameters().get("exceptWithin"));
        }
    }

    @Test
    @DisplayName("Two notification deadlines harmonize to the stricter one")
    void deadlinesHarmonize() {
        NormativeProvision relaxed = requires("A")
                .quantity(Quantity.atMost("notification-deadline", 48, "hours")).build();
        NormativeProvision strict = requires("B")
                .quantity(Quantity.atMost("notification-deadline", 24, "hours")).build();

        try (ConflictEngine engine = engine(SimilarityScorer.unavailable())) {
            ResolutionResult result = single(engine.runCycle(List.of(relaxed, strict)));

            assertEquals(ConflictType.TEMPORAL, result.conflict().getType());
            ResolutionRecord record = result.getRecord().orElseThrow();
            assertEquals(StrategyKind.HARMONIZATION, record.strategy());
            assertEquals("24", record.parameters().get("value"));
            assertEquals("hours", record.parameters().get("unit"));
        }
    }

    @Test
    @DisplayName("A later but looser deadline still harmonizes to the stricter one")
    void laterLooserDeadlineHarmonizes() {
        NormativeProvision strict = requires("A")
                .quantity(Quantity.atMost("notification-deadline", 24, "hours")).build();
        NormativeProvision laterRelaxed = requires("B").effectiveDate(JUN_2023)
                .quantity(Quantity.atMost("notification-deadline", 48, "hours")).build();

        try (ConflictEngine engine = engine(SimilarityScorer.unavailable())) {
            ResolutionRecord record = single(engine.runCycle(List.of(strict, laterRelaxed)))
                    .getRecord().orElseThrow();

            assertEquals(StrategyKind.HARMONIZATION, record.strategy());
            assertEquals("24", record.parameters().get("value"));
        }
    }

    @Test
    @DisplayName("Loosely related provisions are not a semantic conflict")
    void lowSimilarityIsNoConflict() {
        SimilarityScorer scorer = (a, b) -> Optional.of(new SimilarityScore(0.55, 0.9));

        try (ConflictEngine engine = engine(scorer)) {
            CycleReport report = engine.runCycle(List.of(requires("A").build(), permits("B").build()));

            assertTrue(report.detection().created().isEmpty());
            assertTrue(report.detection().semanticPending().isEmpty());
            assertTrue(report.resolutions().isEmpty());
        }
    }

    @Test
    @DisplayName("A semantic conflict no rule can settle goes to a human")
    void unresolvableSemanticConflictEscalates() {
        SimilarityScorer scorer = (a, b) -> Optional.of(new SimilarityScore(0.9, 0.8));

        try (ConflictEngine engine = engine(scorer)) {
            ResolutionResult result = single(engine.runCycle(List.of(requires("A").build(), permits("B").build())));

            assertEquals(ConflictType.SEMANTIC, result.conflict().getType());
            assertEquals(ResolutionResult.Outcome.FAILED, result.outcome());
            assertEquals(FailureReason.STRATEGY_INAPPLICABLE, result.failureReason());
            assertEquals(1, result.getEscalationCase().orElseThrow().getLevel());
        }
    }
}

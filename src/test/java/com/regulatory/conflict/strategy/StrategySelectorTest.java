package com.regulatory.conflict.strategy;

import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.PrecedenceTable;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.PairKey;
import com.regulatory.conflict.core.model.Quantity;
import com.regulatory.conflict.core.model.StrategyKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

import static com.regulatory.conflict.support.ProvisionFixtures.JUN_2023;
import static com.regulatory.conflict.support.ProvisionFixtures.permits;
import static com.regulatory.conflict.support.ProvisionFixtures.prohibits;
import static com.regulatory.conflict.support.ProvisionFixtures.requires;
import static org.junit.jupiter.api.Assertions.*;

class StrategySelectorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 3, 1);

    private final StrategySelector selector = new StrategySelector(EngineConfig.defaults());

    private static Conflict conflict(ConflictType type, NormativeProvision a, NormativeProvision b,
                                     ConflictEvidence evidence) {
        return Conflict.builder()
                .pairKey(PairKey.of(a.getId(), b.getId()))
                .type(type)
                .severity(0.5)
                .evidence(evidence)
                .build();
    }

    private static StrategySelection select(StrategySelector selector, ConflictType type,
                                            NormativeProvision a, NormativeProvision b) {
        return select(selector, type, a, b, ConflictEvidence.builder().build());
    }

    private static StrategySelection select(StrategySelector selector, ConflictType type,
                                            NormativeProvision a, NormativeProvision b, ConflictEvidence evidence) {
        NormativeProvision first = a.getId().compareTo(b.getId()) < 0 ? a : b;
        NormativeProvision second = first == a ? b : a;
        return selector.select(conflict(type, a, b, evidence),
                new ResolutionContext(first, second, Set.of(), AS_OF));
    }

    private static StrategySelection.Selected selected(StrategySelection selection) {
        assertInstanceOf(StrategySelection.Selected.class, selection);
        return (StrategySelection.Selected) selection;
    }

    @Nested
    @DisplayName("Hierarchical conflicts")
    class Hierarchical {

        @Test
        @DisplayName("Should pick Lex Superior with confidence growing with the gap")
        void testLexSuperior() {
            StrategySelection.Selected one = selected(select(selector, ConflictType.HIERARCHICAL,
                    prohibits("A").authorityLevel(2).build(), requires("B").authorityLevel(1).build()));
            StrategySelection.Selected five = selected(select(selector, ConflictType.HIERARCHICAL,
                    prohibits("A").authorityLevel(6).build(), requires("B").authorityLevel(1).build()));

            assertEquals(StrategyKind.LEX_SUPERIOR, one.strategy().kind());
            assertEquals("A", ((LexSuperior) one.strategy()).superiorId());
            assertEquals(0.93, one.rawConfidence(), 1e-9);
            assertEquals(0.99, five.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Disjoint validity windows take precedence")
        void testTemporalResolution() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.HIERARCHICAL,
                    prohibits("A").authorityLevel(2).expiryDate(LocalDate.of(2022, 12, 31)).build(),
                    requires("B").authorityLevel(1).effectiveDate(JUN_2023).build()));

            assertEquals(StrategyKind.TEMPORAL_RESOLUTION, s.strategy().kind());
            assertEquals(0.90, s.rawConfidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Jurisdictional conflicts")
    class Jurisdictional {

        @Test
        @DisplayName("Should prefer a narrower jurisdiction")
        void testLexSpecialisJurisdiction() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.JURISDICTIONAL,
                    requires("A").jurisdiction("US/employers").build(),
                    prohibits("B").jurisdiction("US/employers/large").build()));

            LexSpecialis specialis = (LexSpecialis) s.strategy();
            assertEquals("B", specialis.specialId());
            assertEquals("jurisdiction", specialis.dimension());
            assertEquals(0.85, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Should fall back to a narrower topic set")
        void testLexSpecialisTopic() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.JURISDICTIONAL,
                    requires("A").topicTags("data-breach", "health").build(),
                    prohibits("B").build()));

            LexSpecialis specialis = (LexSpecialis) s.strategy();
            assertEquals("B", specialis.specialId());
            assertEquals("topic", specialis.dimension());
            assertEquals(0.80, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("A delegation rule for the shared topic wins over Lex Specialis")
        void testDelegation() {
            StrategySelector withRules = new StrategySelector(EngineConfig.builder()
                    .delegationRules(Map.of("Data-Breach", "data-protection-board"))
                    .build());

            StrategySelection.Selected s = selected(select(withRules, ConflictType.JURISDICTIONAL,
                    requires("A").jurisdiction("US/employers").build(),
                    prohibits("B").jurisdiction("US/employers/large").build()));

            assertEquals(new Delegation("data-protection-board", "data-breach"), s.strategy());
            assertEquals(0.70, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Should arbitrate by the precedence table")
        void testArbitration() {
            StrategySelector withTable = new StrategySelector(EngineConfig.builder()
                    .precedenceTable(PrecedenceTable.of("treaty", "EU", "national"))
                    .build());

            StrategySelection.Selected s = selected(select(withTable, ConflictType.JURISDICTIONAL,
                    requires("A").jurisdiction("national/DE").build(),
                    prohibits("B").jurisdiction("EU").build()));

            JurisdictionalArbitration arbitration = (JurisdictionalArbitration) s.strategy();
            assertEquals("B", arbitration.winnerId());
            assertEquals("EU", arbitration.winningTier());
            assertEquals(0.80, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Differing context flags select Contextualization")
        void testContextualization() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.JURISDICTIONAL,
                    requires("A").contextFlags("emergency").build(), prohibits("B").build()));

            assertEquals(StrategyKind.CONTEXTUALIZATION, s.strategy().kind());
            assertEquals(0.70, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Should report when no branch applies")
        void testInapplicable() {
            StrategySelection selection = select(selector, ConflictType.JURISDICTIONAL,
                    requires("A").build(), prohibits("B").build());

            assertInstanceOf(StrategySelection.Inapplicable.class, selection);
            assertTrue(((StrategySelection.Inapplicable) selection).reason().contains("JURISDICTIONAL"));
        }
    }

    @Nested
    @DisplayName("Temporal conflicts")
    class Temporal {

        @Test
        @DisplayName("The later enactment of the same issuer and scope wins")
        void testLexPosterior() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.TEMPORAL,
                    requires("A").build(), requires("B").effectiveDate(JUN_2023).build()));

            LexPosterior posterior = (LexPosterior) s.strategy();
            assertEquals("B", posterior.laterId());
            assertEquals(0.88, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Equal dates with comparable quantities harmonize")
        void testHarmonization() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.TEMPORAL,
                    requires("A").quantity(Quantity.atMost("notification-deadline", 48, "hours")).build(),
                    requires("B").quantity(Quantity.atMost("notification-deadline", 24, "hours")).build()));

            assertEquals(StrategyKind.HARMONIZATION, s.strategy().kind());
            assertEquals(0.80, s.rawConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Comparable quantities harmonize even when enacted on different dates")
        void testHarmonizationBeforeLexPosterior() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.TEMPORAL,
                    requires("A").quantity(Quantity.atMost("notification-deadline", 24, "hours")).build(),
                    requires("B").effectiveDate(JUN_2023)
                            .quantity(Quantity.atMost("notification-deadline", 48, "hours")).build()));

            assertEquals(StrategyKind.HARMONIZATION, s.strategy().kind());
        }

        @Test
        @DisplayName("Quantities in different units leave the decision to Lex Posterior")
        void testIncomparableQuantities() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.TEMPORAL,
                    requires("A").quantity(Quantity.atMost("notification-deadline", 1, "days")).build(),
                    requires("B").effectiveDate(JUN_2023)
                            .quantity(Quantity.atMost("notification-deadline", 48, "hours")).build()));

            assertEquals(StrategyKind.LEX_POSTERIOR, s.strategy().kind());
        }

        @Test
        @DisplayName("Different issuers on the same day fall back to Lex Superior")
        void testLexSuperiorFallback() {
            StrategySelection.Selected s = selected(select(selector, ConflictType.TEMPORAL,
                    requires("A").authorityLevel(3).build(), requires("B").build()));

            assertEquals(StrategyKind.LEX_SUPERIOR, s.strategy().kind());
            assertEquals(0.96, s.rawConfidence(), 1e-9);
        }
    }

    @Test
    @DisplayName("Semantic conflicts scale confidence by the scorer's confidence")
    void testSemanticScaling() {
        ConflictEvidence evidence = ConflictEvidence.builder().similarity(0.9, 0.5).build();
        StrategySelection.Selected s = selected(select(selector, ConflictType.SEMANTIC,
                requires("A").authorityLevel(2).build(), permits("B").build(), evidence));

        assertEquals(StrategyKind.LEX_SUPERIOR, s.strategy().kind());
        assertEquals(0.465, s.rawConfidence(), 1e-9);
    }
}

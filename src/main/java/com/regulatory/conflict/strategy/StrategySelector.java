package com.regulatory.conflict.strategy;

import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.HarmonizationPolicy;
import com.regulatory.conflict.config.PrecedenceTable;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Jurisdictions;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.ObligationPolarity;
import com.regulatory.conflict.core.model.Quantity;
import com.regulatory.conflict.core.model.ScheduleEntry;
import com.regulatory.conflict.detection.PairFacts;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Decision tree that picks a {@link ResolutionStrategy} for a conflict.
 *
 * <p>The first level switches over every {@link com.regulatory.conflict.core.model.ConflictType};
 * each type then tries its branches in a fixed order and takes the first that applies.
 * Each branch yields a raw confidence:</p>
 * <ul>
 *   <li>Temporal Resolution 0.90 (disjoint validity windows)</li>
 *   <li>Lex Superior 0.90 + 0.03 per authority step, at most 0.99</li>
 *   <li>Lex Posterior 0.88, Lex Specialis 0.85 (jurisdiction) or 0.80 (topic)</li>
 *   <li>Harmonization 0.80, Jurisdictional Arbitration 0.80</li>
 *   <li>Contextualization 0.70, Delegation 0.70</li>
 * </ul>
 * Semantic conflicts scale the raw confidence by the similarity scorer's own confidence.
 *
 * <p>Temporal conflicts try Harmonization before Lex Posterior: two provisions in force at the
 * same time with comparable quantities can both be met by one combined threshold, whatever
 * their enactment dates. Lex Posterior then only decides between diverging obligations that
 * cannot be combined.</p>
 */
public class StrategySelector {

    static final double TEMPORAL_RESOLUTION_CONFIDENCE = 0.90;
    static final double LEX_SUPERIOR_BASE_CONFIDENCE = 0.90;
    static final double LEX_SUPERIOR_STEP = 0.03;
    static final double LEX_SUPERIOR_CAP = 0.99;
    static final double LEX_POSTERIOR_CONFIDENCE = 0.88;
    static final double LEX_SPECIALIS_JURISDICTION_CONFIDENCE = 0.85;
    static final double LEX_SPECIALIS_TOPIC_CONFIDENCE = 0.80;
    static final double HARMONIZATION_CONFIDENCE = 0.80;
    static final double ARBITRATION_CONFIDENCE = 0.80;
    static final double CONTEXTUALIZATION_CONFIDENCE = 0.70;
    static final double DELEGATION_CONFIDENCE = 0.70;

    private final PrecedenceTable precedenceTable;
    private final Map<String, String> delegationRules;
    private final HarmonizationPolicy harmonizationPolicy;

    public StrategySelector(EngineConfig config) {
        Objects.requireNonNull(config, "config is required");
        this.precedenceTable = config.getPrecedenceTable();
        this.delegationRules = config.getDelegationRules().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue));
        this.harmonizationPolicy = config.getHarmonizationPolicy();
    }

    public StrategySelection select(Conflict conflict, ResolutionContext context) {
        NormativeProvision a = context.first();
        NormativeProvision b = context.second();
        PairFacts facts = PairFacts.of(a, b);
        return switch (conflict.getType()) {
            case HIERARCHICAL -> firstMatch(conflict, List.of(
                    () -> temporalResolution(facts),
                    () -> lexSuperior(a, b)));
            case JURISDICTIONAL -> firstMatch(conflict, List.of(
                    () -> temporalResolution(facts),
                    () -> delegation(facts),
                    () -> lexSpecialis(a, b),
                    () -> jurisdictionalArbitration(a, b),
                    () -> contextualization(a, b)));
            case TEMPORAL -> firstMatch(conflict, List.of(
                    () -> harmonization(a, b),
                    () -> lexPosterior(a, b),
                    () -> lexSpecialis(a, b),
                    () -> lexSuperior(a, b),
                    () -> contextualization(a, b),
                    () -> delegation(facts)));
            case SEMANTIC -> scaleBySimilarityConfidence(conflict, firstMatch(conflict, List.of(
                    () -> temporalResolution(facts),
                    () -> lexSuperior(a, b),
                    () -> lexSpecialis(a, b),
                    () -> lexPosterior(a, b),
                    () -> jurisdictionalArbitration(a, b),
                    () -> contextualization(a, b),
                    () -> delegation(facts))));
        };
    }

    private StrategySelection firstMatch(Conflict conflict, List<Supplier<Optional<StrategySelection.Selected>>> branches) {
        for (Supplier<Optional<StrategySelection.Selected>> branch : branches) {
            Optional<StrategySelection.Selected> selected = branch.get();
            if (selected.isPresent()) {
                return selected.get();
            }
        }
        return new StrategySelection.Inapplicable("No strategy branch applies to " + conflict.getType()
                + " conflict " + conflict.getPairKey());
    }

    private StrategySelection scaleBySimilarityConfidence(Conflict conflict, StrategySelection selection) {
        if (selection instanceof StrategySelection.Selected selected) {
            double scorerConfidence = conflict.getEvidence().similarityConfidenceValue().orElse(1.0);
            return new StrategySelection.Selected(selected.strategy(),
                    selected.rawConfidence() * scorerConfidence, selected.branch());
        }
        return selection;
    }

    Optional<StrategySelection.Selected> temporalResolution(PairFacts facts) {
        if (!Boolean.FALSE.equals(facts.windowsOverlap())) {
            return Optional.empty();
        }
        List<ScheduleEntry> windows = List.of(facts.first(), facts.second()).stream()
                .sorted(Comparator.comparing(p -> p.getEffectiveDate().orElse(LocalDate.MIN)))
                .map(p -> new ScheduleEntry(p.getId(), p.getEffectiveDate().orElse(null),
                        p.getExpiryDate().orElse(null), p.getJurisdiction()))
                .toList();
        return selected(new TemporalResolution(windows), TEMPORAL_RESOLUTION_CONFIDENCE, "disjoint-windows");
    }

    Optional<StrategySelection.Selected> lexSuperior(NormativeProvision a, NormativeProvision b) {
        if (a.getAuthorityLevel().isEmpty() || b.getAuthorityLevel().isEmpty()) {
            return Optional.empty();
        }
        int levelA = a.getAuthorityLevel().get();
        int levelB = b.getAuthorityLevel().get();
        if (levelA == levelB) {
            return Optional.empty();
        }
        NormativeProvision superior = levelA > levelB ? a : b;
        NormativeProvision inferior = superior == a ? b : a;
        int gap = Math.abs(levelA - levelB);
        double confidence = Math.min(LEX_SUPERIOR_CAP, LEX_SUPERIOR_BASE_CONFIDENCE + LEX_SUPERIOR_STEP * gap);
        return selected(new LexSuperior(superior.getId(), inferior.getId(),
                Math.max(levelA, levelB), Math.min(levelA, levelB)), confidence, "authority-differs");
    }

    Optional<StrategySelection.Selected> lexPosterior(NormativeProvision a, NormativeProvision b) {
        if (a.getEffectiveDate().isEmpty() || b.getEffectiveDate().isEmpty()) {
            return Optional.empty();
        }
        LocalDate dateA = a.getEffectiveDate().get();
        LocalDate dateB = b.getEffectiveDate().get();
        // Equal dates fall through to Lex Specialis.
        if (dateA.equals(dateB) || !sameAuthority(a, b) || !sameScope(a, b)) {
            return Optional.empty();
        }
        NormativeProvision later = dateA.isAfter(dateB) ? a : b;
        NormativeProvision earlier = later == a ? b : a;
        return selected(new LexPosterior(later.getId(), earlier.getId(),
                later.getEffectiveDate().get(), earlier.getEffectiveDate().get()),
                LEX_POSTERIOR_CONFIDENCE, "later-enactment");
    }

    Optional<StrategySelection.Selected> lexSpecialis(NormativeProvision a, NormativeProvision b) {
        if (a.hasJurisdiction() && b.hasJurisdiction()) {
            if (Jurisdictions.isStrictlyNarrower(a.getJurisdiction(), b.getJurisdiction())) {
                return selected(new LexSpecialis(a.getId(), b.getId(), a.getJurisdiction(), b.getJurisdiction(),
                        "jurisdiction"), LEX_SPECIALIS_JURISDICTION_CONFIDENCE, "narrower-jurisdiction");
            }
            if (Jurisdictions.isStrictlyNarrower(b.getJurisdiction(), a.getJurisdiction())) {
                return selected(new LexSpecialis(b.getId(), a.getId(), b.getJurisdiction(), a.getJurisdiction(),
                        "jurisdiction"), LEX_SPECIALIS_JURISDICTION_CONFIDENCE, "narrower-jurisdiction");
            }
        }
        Set<String> topicsA = normalized(a.getTopicTags());
        Set<String> topicsB = normalized(b.getTopicTags());
        if (!topicsA.equals(topicsB)) {
            if (!topicsA.isEmpty() && topicsB.containsAll(topicsA)) {
                return selected(new LexSpecialis(a.getId(), b.getId(), topicsA, topicsB, "topic"),
                        LEX_SPECIALIS_TOPIC_CONFIDENCE, "narrower-topic");
            }
            if (!topicsB.isEmpty() && topicsA.containsAll(topicsB)) {
                return selected(new LexSpecialis(b.getId(), a.getId(), topicsB, topicsA, "topic"),
                        LEX_SPECIALIS_TOPIC_CONFIDENCE, "narrower-topic");
            }
        }
        return Optional.empty();
    }

    Optional<StrategySelection.Selected> harmonization(NormativeProvision a, NormativeProvision b) {
        if (a.getPolarity() == ObligationPolarity.PROHIBITS || b.getPolarity() == ObligationPolarity.PROHIBITS) {
            return Optional.empty();
        }
        Optional<Quantity> qa = a.getQuantity();
        Optional<Quantity> qb = b.getQuantity();
        if (qa.isEmpty() || qb.isEmpty() || !qa.get().isComparableTo(qb.get())) {
            return Optional.empty();
        }
        return selected(new Harmonization(a.getId(), qa.get(), b.getId(), qb.get(), harmonizationPolicy),
                HARMONIZATION_CONFIDENCE, "comparable-quantities");
    }

    Optional<StrategySelection.Selected> jurisdictionalArbitration(NormativeProvision a, NormativeProvision b) {
        if (precedenceTable.isEmpty()) {
            return Optional.empty();
        }
        OptionalInt rankA = precedenceTable.rankOf(a.getJurisdiction());
        OptionalInt rankB = precedenceTable.rankOf(b.getJurisdiction());
        if (rankA.isEmpty() || rankB.isEmpty() || rankA.getAsInt() == rankB.getAsInt()) {
            return Optional.empty();
        }
        boolean aWins = rankA.getAsInt() < rankB.getAsInt();
        NormativeProvision winner = aWins ? a : b;
        NormativeProvision loser = aWins ? b : a;
        int winnerRank = Math.min(rankA.getAsInt(), rankB.getAsInt());
        int loserRank = Math.max(rankA.getAsInt(), rankB.getAsInt());
        return selected(new JurisdictionalArbitration(winner.getId(), loser.getId(),
                precedenceTable.tiers().get(winnerRank), winnerRank, loserRank),
                ARBITRATION_CONFIDENCE, "precedence-table");
    }

    Optional<StrategySelection.Selected> contextualization(NormativeProvision a, NormativeProvision b) {
        if (a.getContextFlags().isEmpty() && b.getContextFlags().isEmpty()) {
            return Optional.empty();
        }
        if (a.getContextFlags().equals(b.getContextFlags())) {
            return Optional.empty();
        }
        return selected(new Contextualization(a.getId(), a.getContextFlags(), b.getId(), b.getContextFlags()),
                CONTEXTUALIZATION_CONFIDENCE, "context-flags");
    }

    Optional<StrategySelection.Selected> delegation(PairFacts facts) {
        for (String topic : new TreeSet<>(facts.sharedTopics())) {
            String delegate = delegationRules.get(topic);
            if (delegate != null) {
                return selected(new Delegation(delegate, topic), DELEGATION_CONFIDENCE, "delegation-rule");
            }
        }
        return Optional.empty();
    }

    private static Optional<StrategySelection.Selected> selected(ResolutionStrategy strategy, double confidence,
                                                                 String branch) {
        return Optional.of(new StrategySelection.Selected(strategy, confidence, branch));
    }

    private static boolean sameAuthority(NormativeProvision a, NormativeProvision b) {
        return a.getAuthorityLevel().isPresent() && a.getAuthorityLevel().equals(b.getAuthorityLevel());
    }

    private static boolean sameScope(NormativeProvision a, NormativeProvision b) {
        if (!a.hasJurisdiction() && !b.hasJurisdiction()) {
            return true;
        }
        return Jurisdictions.isCoveredBy(a.getJurisdiction(), b.getJurisdiction())
                && Jurisdictions.isCoveredBy(b.getJurisdiction(), a.getJurisdiction());
    }

    private static Set<String> normalized(Set<String> tags) {
        return tags.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));
    }
}

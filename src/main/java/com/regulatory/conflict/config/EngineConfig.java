package com.regulatory.conflict.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Read-only engine configuration. Built through {@link #builder()}, which validates every
 * value and refuses inconsistent settings with {@link InvalidConfigurationException}.
 */
public class EngineConfig {

    private static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    private static final double DEFAULT_HIGH_SEVERITY_THRESHOLD = 0.8;
    private static final int DEFAULT_AUTHORITY_SCALE = 5;
    private static final int DEFAULT_URGENCY_HORIZON_DAYS = 365;
    private static final int DEFAULT_RESOLUTION_MAX_RETRIES = 3;
    private static final double DEFAULT_PRIOR_STRENGTH = 10.0;
    private static final double DEFAULT_MAX_PRIOR_WEIGHT = 0.5;
    private static final int DEFAULT_NOTIFICATION_MAX_ATTEMPTS = 3;
    private static final int DEFAULT_SIMILARITY_CACHE_SIZE = 10_000;

    private final double confidenceThreshold;
    private final double similarityThreshold;
    private final double highSeverityThreshold;
    private final SeverityWeights severityWeights;
    private final int authorityScale;
    private final int urgencyHorizonDays;
    private final PrecedenceTable precedenceTable;
    private final Map<String, String> delegationRules;
    private final HarmonizationPolicy harmonizationPolicy;
    private final SlaPolicy slaPolicy;
    private final Duration similarityTimeout;
    private final Duration similarityCacheTtl;
    private final int similarityCacheSize;
    private final int detectionParallelism;
    private final Duration detectionTimeout;
    private final int resolutionMaxRetries;
    private final double priorStrength;
    private final double maxPriorWeight;
    private final int notificationMaxAttempts;
    private final Duration notificationRetryDelay;
    private final Duration notificationTimeout;
    private final Clock clock;

    private EngineConfig(Builder builder) {
        this.confidenceThreshold = builder.confidenceThreshold;
        this.similarityThreshold = builder.similarityThreshold;
        this.highSeverityThreshold = builder.highSeverityThreshold;
        this.severityWeights = builder.severityWeights;
        this.authorityScale = builder.authorityScale;
        this.urgencyHorizonDays = builder.urgencyHorizonDays;
        this.precedenceTable = builder.precedenceTable;
        this.delegationRules = Map.copyOf(builder.delegationRules);
        this.harmonizationPolicy = builder.harmonizationPolicy;
        this.slaPolicy = builder.slaPolicy;
        this.similarityTimeout = builder.similarityTimeout;
        this.similarityCacheTtl = builder.similarityCacheTtl;
        this.similarityCacheSize = builder.similarityCacheSize;
        this.detectionParallelism = builder.detectionParallelism;
        this.detectionTimeout = builder.detectionTimeout;
        this.resolutionMaxRetries = builder.resolutionMaxRetries;
        this.priorStrength = builder.priorStrength;
        this.maxPriorWeight = builder.maxPriorWeight;
        this.notificationMaxAttempts = builder.notificationMaxAttempts;
        this.notificationRetryDelay = builder.notificationRetryDelay;
        this.notificationTimeout = builder.notificationTimeout;
        this.clock = builder.clock;
    }

    /** Minimum combined confidence for an automatic resolution. */
    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    /** Minimum similarity for the semantic check to fire. */
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /** Severity at or above which an escalation opens at level 2. */
    public double getHighSeverityThreshold() {
        return highSeverityThreshold;
    }

    public SeverityWeights getSeverityWeights() {
        return severityWeights;
    }

    /** Authority gap that counts as maximal (normalizes the gap to 1.0). */
    public int getAuthorityScale() {
        return authorityScale;
    }

    /** Days ahead beyond which an upcoming effective date carries no urgency. */
    public int getUrgencyHorizonDays() {
        return urgencyHorizonDays;
    }

    public PrecedenceTable getPrecedenceTable() {
        return precedenceTable;
    }

    /** Topic tag to the body that holds resolution authority for it. */
    public Map<String, String> getDelegationRules() {
        return delegationRules;
    }

    public HarmonizationPolicy getHarmonizationPolicy() {
        return harmonizationPolicy;
    }

    public SlaPolicy getSlaPolicy() {
        return slaPolicy;
    }

    public Duration getSimilarityTimeout() {
        return similarityTimeout;
    }

    public Duration getSimilarityCacheTtl() {
        return similarityCacheTtl;
    }

    public int getSimilarityCacheSize() {
        return similarityCacheSize;
    }

    public int getDetectionParallelism() {
        return detectionParallelism;
    }

    public Duration getDetectionTimeout() {
        return detectionTimeout;
    }

    public int getResolutionMaxRetries() {
        return resolutionMaxRetries;
    }

    public double getPriorStrength() {
        return priorStrength;
    }

    public double getMaxPriorWeight() {
        return maxPriorWeight;
    }

    public int getNotificationMaxAttempts() {
        return notificationMaxAttempts;
    }

    public Duration getNotificationRetryDelay() {
        return notificationRetryDelay;
    }

    public Duration getNotificationTimeout() {
        return notificationTimeout;
    }

    public Clock getClock() {
        return clock;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .confidenceThreshold(confidenceThreshold)
                .similarityThreshold(similarityThreshold)
                .highSeverityThreshold(highSeverityThreshold)
                .severityWeights(severityWeights)
                .authorityScale(authorityScale)
                .urgencyHorizonDays(urgencyHorizonDays)
                .precedenceTable(precedenceTable)
                .delegationRules(delegationRules)
                .harmonizationPolicy(harmonizationPolicy)
                .slaPolicy(slaPolicy)
                .similarityTimeout(similarityTimeout)
                .similarityCacheTtl(similarityCacheTtl)
                .similarityCacheSize(similarityCacheSize)
                .detectionParallelism(detectionParallelism)
                .detectionTimeout(detectionTimeout)
                .resolutionMaxRetries(resolutionMaxRetries)
                .priorStrength(priorStrength)
                .maxPriorWeight(maxPriorWeight)
                .notificationMaxAttempts(notificationMaxAttempts)
                .notificationRetryDelay(notificationRetryDelay)
                .notificationTimeout(notificationTimeout)
                .clock(clock);
    }

    public static class Builder {
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private double highSeverityThreshold = DEFAULT_HIGH_SEVERITY_THRESHOLD;
        private SeverityWeights severityWeights = SeverityWeights.defaultWeights();
        private int authorityScale = DEFAULT_AUTHORITY_SCALE;
        private int urgencyHorizonDays = DEFAULT_URGENCY_HORIZON_DAYS;
        private PrecedenceTable precedenceTable = PrecedenceTable.empty();
        private Map<String, String> delegationRules = Map.of();
        private HarmonizationPolicy harmonizationPolicy = HarmonizationPolicy.MOST_RESTRICTIVE;
        private SlaPolicy slaPolicy = SlaPolicy.defaults();
        private Duration similarityTimeout = Duration.ofSeconds(2);
        private Duration similarityCacheTtl = Duration.ofMinutes(10);
        private int similarityCacheSize = DEFAULT_SIMILARITY_CACHE_SIZE;
        private int detectionParallelism = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        private Duration detectionTimeout = Duration.ofMinutes(5);
        private int resolutionMaxRetries = DEFAULT_RESOLUTION_MAX_RETRIES;
        private double priorStrength = DEFAULT_PRIOR_STRENGTH;
        private double maxPriorWeight = DEFAULT_MAX_PRIOR_WEIGHT;
        private int notificationMaxAttempts = DEFAULT_NOTIFICATION_MAX_ATTEMPTS;
        private Duration notificationRetryDelay = Duration.ofMillis(200);
        private Duration notificationTimeout = Duration.ofSeconds(5);
        private Clock clock = Clock.systemUTC();

        public Builder confidenceThreshold(double confidenceThreshold) {
            validateUnit(confidenceThreshold, "confidenceThreshold");
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            validateUnit(similarityThreshold, "similarityThreshold");
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder highSeverityThreshold(double highSeverityThreshold) {
            validateUnit(highSeverityThreshold, "highSeverityThreshold");
            this.highSeverityThreshold = highSeverityThreshold;
            return this;
        }

        public Builder severityWeights(SeverityWeights severityWeights) {
            this.severityWeights = required(severityWeights, "severityWeights");
            return this;
        }

        public Builder authorityScale(int authorityScale) {
            if (authorityScale <= 0) {
                throw new InvalidConfigurationException("authorityScale must be positive");
            }
            this.authorityScale = authorityScale;
            return this;
        }

        public Builder urgencyHorizonDays(int urgencyHorizonDays) {
            if (urgencyHorizonDays <= 0) {
                throw new InvalidConfigurationException("urgencyHorizonDays must be positive");
            }
            this.urgencyHorizonDays = urgencyHorizonDays;
            return this;
        }

        public Builder precedenceTable(PrecedenceTable precedenceTable) {
            this.precedenceTable = required(precedenceTable, "precedenceTable");
            return this;
        }

        public Builder delegationRules(Map<String, String> delegationRules) {
            required(delegationRules, "delegationRules");
            for (Map.Entry<String, String> rule : delegationRules.entrySet()) {
                if (rule.getKey() == null || rule.getKey().isBlank()
                        || rule.getValue() == null || rule.getValue().isBlank()) {
                    throw new InvalidConfigurationException("Delegation rules need a topic and a delegate body");
                }
            }
            this.delegationRules = delegationRules;
            return this;
        }

        public Builder harmonizationPolicy(HarmonizationPolicy harmonizationPolicy) {
            this.harmonizationPolicy = required(harmonizationPolicy, "harmonizationPolicy");
            return this;
        }

        public Builder slaPolicy(SlaPolicy slaPolicy) {
            this.slaPolicy = required(slaPolicy, "slaPolicy");
            return this;
        }

        public Builder similarityTimeout(Duration similarityTimeout) {
            this.similarityTimeout = positive(similarityTimeout, "similarityTimeout");
            return this;
        }

        public Builder similarityCacheTtl(Duration similarityCacheTtl) {
            this.similarityCacheTtl = positive(similarityCacheTtl, "similarityCacheTtl");
            return this;
        }

        public Builder similarityCacheSize(int similarityCacheSize) {
            if (similarityCacheSize <= 0) {
                throw new InvalidConfigurationException("similarityCacheSize must be positive");
            }
            this.similarityCacheSize = similarityCacheSize;
            return this;
        }

        public Builder detectionParallelism(int detectionParallelism) {
            if (detectionParallelism <= 0) {
                throw new InvalidConfigurationException("detectionParallelism must be positive");
            }
            this.detectionParallelism = detectionParallelism;
            return this;
        }

        public Builder detectionTimeout(Duration detectionTimeout) {
            this.detectionTimeout = positive(detectionTimeout, "detectionTimeout");
            return this;
        }

        public Builder resolutionMaxRetries(int resolutionMaxRetries) {
            if (resolutionMaxRetries < 0) {
                throw new InvalidConfigurationException("resolutionMaxRetries must be >= 0");
            }
            this.resolutionMaxRetries = resolutionMaxRetries;
            return this;
        }

        public Builder priorStrength(double priorStrength) {
            if (priorStrength <= 0.0) {
                throw new InvalidConfigurationException("priorStrength must be positive");
            }
            this.priorStrength = priorStrength;
            return this;
        }

        public Builder maxPriorWeight(double maxPriorWeight) {
            validateUnit(maxPriorWeight, "maxPriorWeight");
            this.maxPriorWeight = maxPriorWeight;
            return this;
        }

        public Builder notificationMaxAttempts(int notificationMaxAttempts) {
            if (notificationMaxAttempts <= 0) {
                throw new InvalidConfigurationException("notificationMaxAttempts must be positive");
            }
            this.notificationMaxAttempts = notificationMaxAttempts;
            return this;
        }

        public Builder notificationRetryDelay(Duration notificationRetryDelay) {
            this.notificationRetryDelay = positive(notificationRetryDelay, "notificationRetryDelay");
            return this;
        }

        public Builder notificationTimeout(Duration notificationTimeout) {
            this.notificationTimeout = positive(notificationTimeout, "notificationTimeout");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = required(clock, "clock");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static void validateUnit(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new InvalidConfigurationException(name + " must be between 0.0 and 1.0");
            }
        }

        private static <T> T required(T value, String name) {
            if (value == null) {
                throw new InvalidConfigurationException(name + " is required");
            }
            return value;
        }

        private static Duration positive(Duration value, String name) {
            required(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new InvalidConfigurationException(name + " must be positive");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "confidenceThreshold=" + confidenceThreshold +
                ", similarityThreshold=" + similarityThreshold +
                ", highSeverityThreshold=" + highSeverityThreshold +
                ", severityWeights=" + severityWeights +
                ", precedenceTable=" + precedenceTable +
                ", harmonizationPolicy=" + harmonizationPolicy +
                ", slaPolicy=" + slaPolicy +
                ", detectionParallelism=" + detectionParallelism +
                '}';
    }
}

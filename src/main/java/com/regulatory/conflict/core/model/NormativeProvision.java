package com.regulatory.conflict.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a single normative requirement, prohibition or permission.
 * Owned by the provision source; the engine only reads it. A new version of a provision
 * is a new instance with a new id that points back through {@code previousVersionId}.
 *
 * <p>{@code authorityLevel} and {@code effectiveDate} are optional so that incomplete
 * source data can be represented; checks that need them skip the affected pair.</p>
 */
public final class NormativeProvision {

    private final String id;
    private final String frameworkId;
    private final Set<String> jurisdiction;
    private final Integer authorityLevel;
    private final LocalDate effectiveDate;
    private final LocalDate expiryDate;
    private final String supersededBy;
    private final String previousVersionId;
    private final ObligationPolarity polarity;
    private final Set<String> topicTags;
    private final String obligation;
    private final Quantity quantity;
    private final Set<String> contextFlags;
    private final String text;

    private NormativeProvision(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.frameworkId = Objects.requireNonNull(builder.frameworkId, "frameworkId is required");
        this.polarity = Objects.requireNonNull(builder.polarity, "polarity is required");
        this.jurisdiction = builder.jurisdiction != null ? Set.copyOf(builder.jurisdiction) : Set.of();
        this.topicTags = builder.topicTags != null ? Set.copyOf(builder.topicTags) : Set.of();
        this.contextFlags = builder.contextFlags != null ? Set.copyOf(builder.contextFlags) : Set.of();
        this.authorityLevel = builder.authorityLevel;
        this.effectiveDate = builder.effectiveDate;
        this.expiryDate = builder.expiryDate;
        this.supersededBy = builder.supersededBy;
        this.previousVersionId = builder.previousVersionId;
        this.obligation = builder.obligation;
        this.quantity = builder.quantity;
        this.text = builder.text;
        if (effectiveDate != null && expiryDate != null && expiryDate.isBefore(effectiveDate)) {
            throw new IllegalArgumentException("expiryDate precedes effectiveDate for provision " + id);
        }
    }

    public String getId() {
        return id;
    }

    public String getFrameworkId() {
        return frameworkId;
    }

    public Set<String> getJurisdiction() {
        return jurisdiction;
    }

    public Optional<Integer> getAuthorityLevel() {
        return Optional.ofNullable(authorityLevel);
    }

    public Optional<LocalDate> getEffectiveDate() {
        return Optional.ofNullable(effectiveDate);
    }

    public Optional<LocalDate> getExpiryDate() {
        return Optional.ofNullable(expiryDate);
    }

    public Optional<String> getSupersededBy() {
        return Optional.ofNullable(supersededBy);
    }

    public Optional<String> getPreviousVersionId() {
        return Optional.ofNullable(previousVersionId);
    }

    public ObligationPolarity getPolarity() {
        return polarity;
    }

    public Set<String> getTopicTags() {
        return topicTags;
    }

    public String getObligation() {
        return obligation;
    }

    public Optional<Quantity> getQuantity() {
        return Optional.ofNullable(quantity);
    }

    public Set<String> getContextFlags() {
        return contextFlags;
    }

    public String getText() {
        return text != null ? text : (obligation != null ? obligation : "");
    }

    public boolean hasJurisdiction() {
        return !jurisdiction.isEmpty();
    }

    /**
     * Returns whether this provision replaces {@code other}, either through the explicit
     * {@code supersededBy} link on {@code other} or through the revision chain.
     */
    public boolean supersedes(NormativeProvision other) {
        return id.equals(other.supersededBy) || other.id.equals(previousVersionId);
    }

    /**
     * Returns whether the provision is in force on the given day. Provisions without an
     * effective date are treated as always in force.
     */
    public boolean isActiveOn(LocalDate day) {
        if (effectiveDate != null && day.isBefore(effectiveDate)) {
            return false;
        }
        return expiryDate == null || !day.isAfter(expiryDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormativeProvision that = (NormativeProvision) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "NormativeProvision{" +
                "id='" + id + '\'' +
                ", frameworkId='" + frameworkId + '\'' +
                ", polarity=" + polarity +
                ", authorityLevel=" + authorityLevel +
                ", effectiveDate=" + effectiveDate +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this provision's fields, for deriving a new version.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .frameworkId(frameworkId)
                .jurisdiction(jurisdiction)
                .authorityLevel(authorityLevel)
                .effectiveDate(effectiveDate)
                .expiryDate(expiryDate)
                .supersededBy(supersededBy)
                .previousVersionId(previousVersionId)
                .polarity(polarity)
                .topicTags(topicTags)
                .obligation(obligation)
                .quantity(quantity)
                .contextFlags(contextFlags)
                .text(text);
    }

    public static class Builder {
        private String id;
        private String frameworkId;
        private Set<String> jurisdiction;
        private Integer authorityLevel;
        private LocalDate effectiveDate;
        private LocalDate expiryDate;
        private String supersededBy;
        private String previousVersionId;
        private ObligationPolarity polarity;
        private Set<String> topicTags;
        private String obligation;
        private Quantity quantity;
        private Set<String> contextFlags;
        private String text;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder frameworkId(String frameworkId) {
            this.frameworkId = frameworkId;
            return this;
        }

        public Builder jurisdiction(Set<String> jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder jurisdiction(String... jurisdiction) {
            this.jurisdiction = Set.of(jurisdiction);
            return this;
        }

        public Builder authorityLevel(Integer authorityLevel) {
            this.authorityLevel = authorityLevel;
            return this;
        }

        public Builder effectiveDate(LocalDate effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder expiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
            return this;
        }

        public Builder supersededBy(String supersededBy) {
            this.supersededBy = supersededBy;
            return this;
        }

        public Builder previousVersionId(String previousVersionId) {
            this.previousVersionId = previousVersionId;
            return this;
        }

        public Builder polarity(ObligationPolarity polarity) {
            this.polarity = polarity;
            return this;
        }

        public Builder topicTags(Set<String> topicTags) {
            this.topicTags = topicTags;
            return this;
        }

        public Builder topicTags(String... topicTags) {
            this.topicTags = Set.of(topicTags);
            return this;
        }

        public Builder obligation(String obligation) {
            this.obligation = obligation;
            return this;
        }

        public Builder quantity(Quantity quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder contextFlags(Set<String> contextFlags) {
            this.contextFlags = contextFlags;
            return this;
        }

        public Builder contextFlags(String... contextFlags) {
            this.contextFlags = Set.of(contextFlags);
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public NormativeProvision build() {
            return new NormativeProvision(this);
        }
    }
}

package io.casengine.core.engine;

import io.casengine.core.model.Domain;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.TargetForm;
import java.util.Objects;

/**
 * Engine-wide defaults. Per-call options (e.g. {@link SimplifyOptions}) override them.
 *
 * <p>
 * Immutable and thread-safe. Use {@link #builder()} to construct instances.
 *
 * @param maxSteps          pass budget of every simplification (default: 50)
 * @param targetForm        default simplification target (default: simplified)
 * @param domain            number domain for domain-sensitive rules (default: real)
 * @param defaultVariable   variable used when a caller passes none (default: {@code x})
 * @param seriesOrder       default Taylor order (default: 5)
 * @param numericFallback   allow numeric root finding when no closed form exists (default: true)
 * @param rootSearchMin     lower end of the numeric root search interval (default: -10)
 * @param rootSearchMax     upper end of the numeric root search interval (default: 10)
 * @param rootSearchSamples sample count of the numeric root scan (default: 2000)
 */
public record CasConfig(
        int maxSteps,
        TargetForm targetForm,
        Domain domain,
        String defaultVariable,
        int seriesOrder,
        boolean numericFallback,
        double rootSearchMin,
        double rootSearchMax,
        int rootSearchSamples) {

    /** All defaults. */
    public static final CasConfig DEFAULT = builder().build();

    public CasConfig {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        Objects.requireNonNull(targetForm, "targetForm must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(defaultVariable, "defaultVariable must not be null");
        if (seriesOrder < 0) {
            throw new IllegalArgumentException("seriesOrder must not be negative, got: " + seriesOrder);
        }
        if (!(rootSearchMin < rootSearchMax)) {
            throw new IllegalArgumentException(
                    "rootSearchMin must be below rootSearchMax, got: [" + rootSearchMin + ", " + rootSearchMax + "]");
        }
        if (rootSearchSamples < 2) {
            throw new IllegalArgumentException("rootSearchSamples must be at least 2, got: " + rootSearchSamples);
        }
    }

    /** Simplification options derived from this config. */
    public SimplifyOptions simplifyOptions() {
        return new SimplifyOptions(maxSteps, targetForm, domain);
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CasConfig}. All fields have defaults. */
    public static final class Builder {
        private int maxSteps = 50;
        private TargetForm targetForm = TargetForm.SIMPLIFIED;
        private Domain domain = Domain.REAL;
        private String defaultVariable = "x";
        private int seriesOrder = 5;
        private boolean numericFallback = true;
        private double rootSearchMin = -10;
        private double rootSearchMax = 10;
        private int rootSearchSamples = 2000;

        Builder() {}

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder targetForm(TargetForm targetForm) {
            this.targetForm = targetForm;
            return this;
        }

        public Builder domain(Domain domain) {
            this.domain = domain;
            return this;
        }

        public Builder defaultVariable(String defaultVariable) {
            this.defaultVariable = defaultVariable;
            return this;
        }

        public Builder seriesOrder(int seriesOrder) {
            this.seriesOrder = seriesOrder;
            return this;
        }

        public Builder numericFallback(boolean numericFallback) {
            this.numericFallback = numericFallback;
            return this;
        }

        public Builder rootSearchMin(double rootSearchMin) {
            this.rootSearchMin = rootSearchMin;
            return this;
        }

        public Builder rootSearchMax(double rootSearchMax) {
            this.rootSearchMax = rootSearchMax;
            return this;
        }

        public Builder rootSearchSamples(int rootSearchSamples) {
            this.rootSearchSamples = rootSearchSamples;
            return this;
        }

        public CasConfig build() {
            return new CasConfig(
                    maxSteps,
                    targetForm,
                    domain,
                    defaultVariable,
                    seriesOrder,
                    numericFallback,
                    rootSearchMin,
                    rootSearchMax,
                    rootSearchSamples);
        }
    }
}

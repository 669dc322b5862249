package io.casengine.core.model;

import java.util.Objects;

/**
 * Options for a single simplification.
 *
 * @param maxSteps   upper bound on rule-application passes (default: 50)
 * @param targetForm final shape of the result (default: {@link TargetForm#SIMPLIFIED})
 * @param domain     number domain for domain-sensitive rules (default: {@link Domain#REAL})
 */
public record SimplifyOptions(int maxSteps, TargetForm targetForm, Domain domain) {

    /** 50 passes, simplified form, real domain. */
    public static final SimplifyOptions DEFAULT = new SimplifyOptions(50, TargetForm.SIMPLIFIED, Domain.REAL);

    public SimplifyOptions {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        Objects.requireNonNull(targetForm, "targetForm must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
    }

    public SimplifyOptions withTargetForm(TargetForm form) {
        return new SimplifyOptions(maxSteps, form, domain);
    }
}

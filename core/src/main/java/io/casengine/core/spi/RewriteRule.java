package io.casengine.core.spi;

import io.casengine.core.model.Domain;
import io.casengine.core.model.Expr;

/**
 * A local rewrite of one expression node. Rules see a single node whose children have already
 * been processed; the simplifier handles traversal.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface RewriteRule {

    /**
     * Returns the rule identifier, e.g. {@code "combine-like-terms"}. Recorded on every step the
     * rule produces.
     *
     * @return a non-null, non-empty identifier (lowercase, hyphenated)
     */
    String id();

    RuleCategory category();

    /** One-sentence explanation used for step traces. */
    String description();

    /**
     * Rewrites {@code expr}, or returns the same instance when the rule does not apply. A rule
     * facing an ambiguous match returns its input unchanged.
     */
    Expr rewrite(Expr expr);

    /** {@code false} for identities that are only valid over the reals. */
    default boolean appliesIn(Domain domain) {
        return true;
    }

    default RuleStage stage() {
        return RuleStage.FIXPOINT;
    }
}

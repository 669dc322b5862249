package io.casengine.core.rules;

import io.casengine.core.model.Domain;
import io.casengine.core.model.Expr;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import io.casengine.core.spi.RuleStage;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** A {@link RewriteRule} backed by a function. Used by the built-in rule sets. */
record NamedRule(
        String id,
        RuleCategory category,
        String description,
        UnaryOperator<Expr> rewriter,
        boolean realOnly,
        RuleStage stage)
        implements RewriteRule {

    NamedRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(rewriter, "rewriter must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
    }

    static NamedRule of(String id, RuleCategory category, String description, UnaryOperator<Expr> rewriter) {
        return new NamedRule(id, category, description, rewriter, false, RuleStage.FIXPOINT);
    }

    static NamedRule realOnly(String id, RuleCategory category, String description, UnaryOperator<Expr> rewriter) {
        return new NamedRule(id, category, description, rewriter, true, RuleStage.FIXPOINT);
    }

    static NamedRule staged(
            String id, RuleCategory category, String description, RuleStage stage, UnaryOperator<Expr> rewriter) {
        return new NamedRule(id, category, description, rewriter, false, stage);
    }

    @Override
    public Expr rewrite(Expr expr) {
        Expr out = rewriter.apply(expr);
        // structurally equal output counts as "did not apply"
        return out == null || out.equals(expr) ? expr : out;
    }

    @Override
    public boolean appliesIn(Domain domain) {
        return !realOnly || domain == Domain.REAL;
    }

    @Override
    public String toString() {
        return "RewriteRule[" + id + "]";
    }
}

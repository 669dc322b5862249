package io.casengine.core.engine;

import io.casengine.core.model.Expr;
import io.casengine.core.model.SimplifyOptions;
import io.casengine.core.model.StepLog;
import io.casengine.core.model.TargetForm;
import io.casengine.core.rules.RuleRegistry;
import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import io.casengine.core.spi.RuleStage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the registered rewrite rules until the tree stops changing.
 *
 * <p>
 * One pass visits the rule categories in declaration order (arithmetic, algebraic,
 * trigonometric, exponential, logarithmic). Each category walks the whole tree bottom-up and
 * tries each of its rules once per node. A pass whose output is structurally equal to its input
 * is the fixpoint. At most {@link SimplifyOptions#maxSteps()} passes run; running out is not an
 * error, but it is logged and reported as a warning.
 *
 * <p>
 * For {@link TargetForm#EXPANDED} and {@link TargetForm#FACTORED} the stage rules then run to
 * their own fixpoint, followed by a normal clean-up, repeated until neither changes the tree.
 *
 * <p>
 * Thread-safe: holds no per-call state.
 */
public final class Simplifier {

    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    static final String OPERATION = "simplify";

    private final RuleRegistry registry;

    /**
     * Result of one simplification.
     *
     * @param result    the simplified tree
     * @param passes    passes run, over all stages
     * @param converged {@code false} if the pass budget ran out first
     * @param warnings  conditions to surface to the caller
     */
    public record Outcome(Expr result, int passes, boolean converged, List<String> warnings) {
        public Outcome {
            warnings = List.copyOf(warnings);
        }
    }

    public Simplifier(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Simplifies without keeping a trace. */
    public Expr simplify(Expr expr, SimplifyOptions options) {
        return simplify(expr, options, new StepLog()).result();
    }

    /**
     * Simplifies {@code expr}, appending one step per productive rewrite to {@code log}.
     */
    public Outcome simplify(Expr expr, SimplifyOptions options, StepLog log) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(log, "log must not be null");

        Run run = new Run(options, log);
        Expr current = run.toFixpoint(expr, RuleStage.FIXPOINT);

        RuleStage stage = stageFor(options.targetForm());
        if (stage != null) {
            for (int round = 0; round < options.maxSteps() && run.converged; round++) {
                Expr staged = run.toFixpoint(current, stage);
                Expr cleaned = run.toFixpoint(staged, RuleStage.FIXPOINT);
                if (cleaned.equals(current)) {
                    break;
                }
                current = cleaned;
            }
        }

        List<String> warnings = new ArrayList<>();
        if (!run.converged) {
            LOG.warn(
                    "simplify.budget_exhausted max_steps={} passes={} expression={}",
                    options.maxSteps(),
                    run.passes,
                    current);
            warnings.add("Simplification stopped after " + options.maxSteps()
                    + " passes without reaching a fixpoint; the result may not be fully simplified");
        }
        LOG.debug("simplify.done passes={} steps={} result={}", run.passes, log.size(), current);
        return new Outcome(current, run.passes, run.converged, warnings);
    }

    private static RuleStage stageFor(TargetForm form) {
        return switch (form) {
            case SIMPLIFIED -> null;
            case EXPANDED -> RuleStage.EXPAND;
            case FACTORED -> RuleStage.FACTOR;
        };
    }

    /** Per-call state: pass counter, convergence flag and the rule lists for the domain. */
    private final class Run {
        private final SimplifyOptions options;
        private final StepLog log;
        private int passes;
        private boolean converged = true;

        Run(SimplifyOptions options, StepLog log) {
            this.options = options;
            this.log = log;
        }

        Expr toFixpoint(Expr expr, RuleStage stage) {
            List<List<RewriteRule>> categories = rulesFor(stage);
            Expr current = expr;
            for (int i = 0; i < options.maxSteps(); i++) {
                passes++;
                Expr next = current;
                for (List<RewriteRule> rules : categories) {
                    next = rewriteBottomUp(next, rules);
                }
                if (next.equals(current)) {
                    return next;
                }
                current = next;
            }
            converged = false;
            return current;
        }

        private List<List<RewriteRule>> rulesFor(RuleStage stage) {
            List<List<RewriteRule>> out = new ArrayList<>();
            for (RuleCategory category : RuleCategory.values()) {
                List<RewriteRule> rules = new ArrayList<>();
                for (RewriteRule rule : registry.rules(category, stage)) {
                    if (rule.appliesIn(options.domain())) {
                        rules.add(rule);
                    }
                }
                if (!rules.isEmpty()) {
                    out.add(rules);
                }
            }
            return out;
        }

        private Expr rewriteBottomUp(Expr expr, List<RewriteRule> rules) {
            List<Expr> children = expr.children();
            Expr node = expr;
            if (!children.isEmpty()) {
                List<Expr> rewritten = new ArrayList<>(children.size());
                for (Expr child : children) {
                    rewritten.add(rewriteBottomUp(child, rules));
                }
                node = expr.withChildren(rewritten);
            }
            for (RewriteRule rule : rules) {
                Expr out = rule.rewrite(node);
                if (out != node && !out.equals(node)) {
                    log.record(OPERATION, node, out, rule.id(), rule.description());
                    LOG.trace("simplify.rule rule={} before={} after={}", rule.id(), node, out);
                    node = out;
                }
            }
            return node;
        }
    }
}

package io.casengine.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StepLog")
class StepLogTest {

    private static final Expr X = Expr.var("x");

    @Test
    @DisplayName("indices start at 1 and follow recording order")
    void indicesFollowOrder() {
        var log = new StepLog();
        log.record("simplify", X, X, "a", "first");
        log.record("simplify", X, X, "b", "second");

        assertThat(log.steps()).extracting(Step::index).containsExactly(1, 2);
        assertThat(log.steps()).extracting(Step::rule).containsExactly("a", "b");
    }

    @Test
    @DisplayName("appendAll renumbers the appended steps")
    void appendAllRenumbers() {
        var log = new StepLog();
        log.record("differentiate", X, X, "power-rule", "n*x^(n-1)");
        var other = List.of(new Step(1, "simplify", X, X, "constant-folding", "fold"));

        log.appendAll(other);

        assertThat(log.size()).isEqualTo(2);
        assertThat(log.steps().get(1).index()).isEqualTo(2);
        assertThat(log.steps().get(1).operation()).isEqualTo("simplify");
    }

    @Test
    @DisplayName("snapshots are unaffected by later records")
    void snapshotsAreImmutable() {
        var log = new StepLog();
        var before = log.steps();
        log.record("simplify", X, X, "a", "first");

        assertThat(before).isEmpty();
        assertThatThrownBy(() -> log.steps().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("a step index below 1 is rejected")
    void rejectsZeroIndex() {
        assertThatThrownBy(() -> new Step(0, "simplify", X, X, "a", "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index");
    }
}

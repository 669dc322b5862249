package io.casengine.core.rules;

import static io.casengine.core.model.Expr.add;
import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.sub;
import static io.casengine.core.model.Expr.var;
import static org.assertj.core.api.Assertions.assertThat;

import io.casengine.core.model.Expr;
import io.casengine.core.spi.RuleStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AlgebraicRules")
class AlgebraicRulesTest {

    private static final Expr X = var("x");
    private static final Expr Y = var("y");

    @Nested
    @DisplayName("coefficient-ordering")
    class Ordering {

        @Test
        @DisplayName("moves a trailing coefficient to the front")
        void trailingCoefficient() {
            assertThat(AlgebraicRules.orderCoefficients(mul(X, num(3)))).isEqualTo(mul(num(3), X));
        }

        @Test
        @DisplayName("merges nested coefficients")
        void mergesCoefficients() {
            assertThat(AlgebraicRules.orderCoefficients(mul(num(2), mul(num(3), X)))).isEqualTo(mul(num(6), X));
        }

        @Test
        @DisplayName("lifts an inner coefficient out of a product")
        void liftsInnerCoefficient() {
            assertThat(AlgebraicRules.orderCoefficients(mul(X, mul(num(4), Y))))
                    .isEqualTo(mul(num(4), mul(X, Y)));
            assertThat(AlgebraicRules.orderCoefficients(mul(mul(num(4), X), Y)))
                    .isEqualTo(mul(num(4), mul(X, Y)));
        }
    }

    @Nested
    @DisplayName("combine-like-terms")
    class LikeTerms {

        @Test
        @DisplayName("adds coefficients of equal symbolic parts")
        void addsCoefficients() {
            assertThat(AlgebraicRules.combineLikeTerms(add(mul(num(2), X), mul(num(3), X))))
                    .isEqualTo(mul(num(5), X));
        }

        @Test
        @DisplayName("cancelling terms leave zero")
        void cancellation() {
            assertThat(AlgebraicRules.combineLikeTerms(sub(add(X, num(1)), X))).isEqualTo(num(1));
        }

        @Test
        @DisplayName("collects constants and keeps first-occurrence order")
        void keepsOrder() {
            var expr = add(add(add(X, num(2)), mul(num(3), X)), num(5));

            assertThat(AlgebraicRules.combineLikeTerms(expr)).isEqualTo(add(mul(num(4), X), num(7)));
        }

        @Test
        @DisplayName("unlike terms are returned unchanged")
        void unlikeTerms() {
            var expr = add(X, Y);
            assertThat(AlgebraicRules.combineLikeTerms(expr)).isSameAs(expr);
        }
    }

    @Nested
    @DisplayName("simplify-fractions")
    class Fractions {

        @Test
        @DisplayName("divides a coefficient by a constant denominator")
        void coefficientOverConstant() {
            assertThat(AlgebraicRules.simplifyFractions(div(mul(num(4), X), num(2)))).isEqualTo(mul(num(2), X));
        }

        @Test
        @DisplayName("a coefficient times a fraction cancels")
        void coefficientTimesFraction() {
            assertThat(AlgebraicRules.simplifyFractions(mul(num(3), div(X, num(3))))).isEqualTo(X);
        }

        @Test
        @DisplayName("reduces integer coefficients by their gcd")
        void reducesByGcd() {
            assertThat(AlgebraicRules.simplifyFractions(div(mul(num(6), X), mul(num(4), Y))))
                    .isEqualTo(div(mul(num(3), X), mul(num(2), Y)));
        }

        @Test
        @DisplayName("nested constant divisors multiply")
        void nestedDivisors() {
            assertThat(AlgebraicRules.simplifyFractions(div(div(pow(X, num(2)), num(2)), num(2))))
                    .isEqualTo(div(pow(X, num(2)), num(4)));
        }

        @Test
        @DisplayName("a reciprocal factor turns the product into a quotient")
        void reciprocalFactor() {
            assertThat(AlgebraicRules.simplifyFractions(mul(num(2), div(num(1), X)))).isEqualTo(div(num(2), X));
            assertThat(AlgebraicRules.simplifyFractions(mul(div(num(1), pow(X, num(2))), Y)))
                    .isEqualTo(div(Y, pow(X, num(2))));
        }

        @Test
        @DisplayName("constant fractions are left to constant folding")
        void constantFraction() {
            var half = div(num(1), num(2));
            assertThat(AlgebraicRules.simplifyFractions(half)).isSameAs(half);
        }
    }

    @Nested
    @DisplayName("expand-products")
    class Expansion {

        @Test
        @DisplayName("distributes over a sum on either side")
        void distributes() {
            assertThat(AlgebraicRules.expandProducts(mul(X, add(Y, num(1)))))
                    .isEqualTo(add(mul(X, Y), mul(X, num(1))));
            assertThat(AlgebraicRules.expandProducts(mul(sub(X, num(1)), Y)))
                    .isEqualTo(sub(mul(X, Y), mul(num(1), Y)));
        }

        @Test
        @DisplayName("unrolls small integer powers of sums")
        void smallPowers() {
            var sum = add(X, num(1));
            assertThat(AlgebraicRules.expandProducts(pow(sum, num(2)))).isEqualTo(mul(sum, sum));
            assertThat(AlgebraicRules.expandProducts(pow(sum, num(3)))).isEqualTo(mul(sum, pow(sum, num(2))));
        }

        @Test
        @DisplayName("large powers stay folded")
        void largePowers() {
            var expr = pow(add(X, num(1)), num(7));
            assertThat(AlgebraicRules.expandProducts(expr)).isSameAs(expr);
        }
    }

    @Test
    @DisplayName("expansion and factoring run only in their own stage")
    void stagedRules() {
        var registry = RuleRegistry.standard();

        assertThat(registry.requireRule("expand-products").stage()).isEqualTo(RuleStage.EXPAND);
        assertThat(registry.requireRule("factor-common-term").stage()).isEqualTo(RuleStage.FACTOR);
        assertThat(registry.requireRule("combine-like-terms").stage()).isEqualTo(RuleStage.FIXPOINT);
    }
}

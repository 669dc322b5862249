package io.casengine.core.rules;

import static io.casengine.core.model.Expr.add;
import static io.casengine.core.model.Expr.call;
import static io.casengine.core.model.Expr.div;
import static io.casengine.core.model.Expr.mul;
import static io.casengine.core.model.Expr.neg;
import static io.casengine.core.model.Expr.num;
import static io.casengine.core.model.Expr.pow;
import static io.casengine.core.model.Expr.sub;
import static io.casengine.core.model.Expr.var;
import static org.assertj.core.api.Assertions.assertThat;

import io.casengine.core.model.Expr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ArithmeticRules")
class ArithmeticRulesTest {

    private static final Expr X = var("x");
    private static final Expr Y = var("y");

    @Nested
    @DisplayName("constant-folding")
    class Folding {

        @Test
        @DisplayName("folds the four basic operations")
        void basicOperations() {
            assertThat(ArithmeticRules.foldConstants(add(num(2), num(3)))).isEqualTo(num(5));
            assertThat(ArithmeticRules.foldConstants(sub(num(2), num(3)))).isEqualTo(num(-1));
            assertThat(ArithmeticRules.foldConstants(mul(num(4), num(3)))).isEqualTo(num(12));
            assertThat(ArithmeticRules.foldConstants(div(num(2), num(4)))).isEqualTo(div(num(1), num(2)));
        }

        @Test
        @DisplayName("adds fractions exactly")
        void fractions() {
            assertThat(ArithmeticRules.foldConstants(add(div(num(1), num(2)), div(num(1), num(3)))))
                    .isEqualTo(div(num(5), num(6)));
        }

        @Test
        @DisplayName("leaves division by zero alone")
        void divisionByZero() {
            var expr = div(num(1), num(0));
            assertThat(ArithmeticRules.foldConstants(expr)).isSameAs(expr);
        }

        @Test
        @DisplayName("folds powers only when the result is exact")
        void powers() {
            assertThat(ArithmeticRules.foldConstants(pow(num(2), num(10)))).isEqualTo(num(1024));
            var irrational = pow(num(2), div(num(1), num(2)));
            assertThat(ArithmeticRules.foldConstants(irrational)).isSameAs(irrational);
        }

        @Test
        @DisplayName("folds function calls with integer results only")
        void calls() {
            assertThat(ArithmeticRules.foldConstants(call("sqrt", num(9)))).isEqualTo(num(3));
            var sqrtFive = call("sqrt", num(5));
            assertThat(ArithmeticRules.foldConstants(sqrtFive)).isSameAs(sqrtFive);
            var unknown = call("gamma", num(3));
            assertThat(ArithmeticRules.foldConstants(unknown)).isSameAs(unknown);
        }
    }

    @Test
    @DisplayName("additive identity drops zeros and negates 0 - b")
    void additiveIdentity() {
        assertThat(ArithmeticRules.additiveIdentity(add(X, num(0)))).isEqualTo(X);
        assertThat(ArithmeticRules.additiveIdentity(add(num(0), X))).isEqualTo(X);
        assertThat(ArithmeticRules.additiveIdentity(sub(X, num(0)))).isEqualTo(X);
        assertThat(ArithmeticRules.additiveIdentity(sub(num(0), X))).isEqualTo(neg(X));
    }

    @Test
    @DisplayName("products with one or zero")
    void multiplicativeIdentityAndZeroProduct() {
        assertThat(ArithmeticRules.multiplicativeIdentity(mul(num(1), X))).isEqualTo(X);
        assertThat(ArithmeticRules.multiplicativeIdentity(mul(X, num(1)))).isEqualTo(X);
        assertThat(ArithmeticRules.zeroProduct(mul(call("sin", X), num(0)))).isEqualTo(num(0));
    }

    @Test
    @DisplayName("power identities keep 0^0 unevaluated")
    void powerIdentity() {
        assertThat(ArithmeticRules.powerIdentity(pow(X, num(1)))).isEqualTo(X);
        assertThat(ArithmeticRules.powerIdentity(pow(X, num(0)))).isEqualTo(num(1));
        assertThat(ArithmeticRules.powerIdentity(pow(num(1), X))).isEqualTo(num(1));
        assertThat(ArithmeticRules.powerIdentity(pow(num(0), num(3)))).isEqualTo(num(0));
        var zeroToZero = pow(num(0), num(0));
        assertThat(ArithmeticRules.powerIdentity(zeroToZero)).isSameAs(zeroToZero);
    }

    @Test
    @DisplayName("division identities")
    void divisionIdentity() {
        assertThat(ArithmeticRules.divisionIdentity(div(X, num(1)))).isEqualTo(X);
        assertThat(ArithmeticRules.divisionIdentity(div(X, num(-1)))).isEqualTo(neg(X));
        assertThat(ArithmeticRules.divisionIdentity(div(num(0), X))).isEqualTo(num(0));
    }

    @Test
    @DisplayName("self subtraction and self division")
    void selfCancellation() {
        assertThat(ArithmeticRules.selfSubtraction(sub(call("sin", X), call("sin", X)))).isEqualTo(num(0));
        assertThat(ArithmeticRules.selfDivision(div(X, X))).isEqualTo(num(1));
        var zeroOverZero = div(num(0), num(0));
        assertThat(ArithmeticRules.selfDivision(zeroOverZero)).isSameAs(zeroOverZero);
    }

    @Test
    @DisplayName("negative addends become subtractions")
    void negationNormalisation() {
        assertThat(ArithmeticRules.normaliseNegation(add(X, num(-3)))).isEqualTo(sub(X, num(3)));
        assertThat(ArithmeticRules.normaliseNegation(add(X, mul(num(-2), Y)))).isEqualTo(sub(X, mul(num(2), Y)));
        assertThat(ArithmeticRules.normaliseNegation(add(X, neg(Y)))).isEqualTo(sub(X, Y));
        assertThat(ArithmeticRules.normaliseNegation(sub(X, num(-3)))).isEqualTo(add(X, num(3)));
        assertThat(ArithmeticRules.normaliseNegation(neg(neg(X)))).isEqualTo(X);
    }

    @Test
    @DisplayName("every rule is registered in the arithmetic category")
    void ruleIds() {
        assertThat(ArithmeticRules.all())
                .extracting(r -> r.id())
                .contains("constant-folding", "additive-identity", "negation-normalisation");
    }
}

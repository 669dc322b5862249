package io.casengine.core.render;

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
import org.junit.jupiter.api.Test;

@DisplayName("DefaultLatexRenderer")
class DefaultLatexRendererTest {

    private static final Expr X = var("x");

    private final DefaultLatexRenderer renderer = new DefaultLatexRenderer();

    @Test
    @DisplayName("numeric coefficients are juxtaposed")
    void coefficients() {
        assertThat(renderer.render(mul(num(3), pow(X, num(2))))).isEqualTo("3x^{2}");
        assertThat(renderer.render(mul(X, var("y")))).isEqualTo("x \\cdot y");
        assertThat(renderer.render(mul(num(2), num(3)))).isEqualTo("2 \\cdot 3");
    }

    @Test
    @DisplayName("fractions and powers use braces")
    void fractionsAndPowers() {
        assertThat(renderer.render(div(num(1), num(2)))).isEqualTo("\\frac{1}{2}");
        assertThat(renderer.render(pow(add(X, num(1)), num(2)))).isEqualTo("\\left(x + 1\\right)^{2}");
        assertThat(renderer.render(pow(call("sin", X), num(2)))).isEqualTo("\\left(\\sin\\left(x\\right)\\right)^{2}");
    }

    @Test
    @DisplayName("signs and grouping")
    void signs() {
        assertThat(renderer.render(neg(X))).isEqualTo("-x");
        assertThat(renderer.render(sub(X, add(var("y"), num(1))))).isEqualTo("x - \\left(y + 1\\right)");
        assertThat(renderer.render(new Expr.Equation(X, num(2)))).isEqualTo("x = 2");
    }

    @Test
    @DisplayName("functions and constants")
    void functions() {
        assertThat(renderer.render(call("sin", X))).isEqualTo("\\sin\\left(x\\right)");
        assertThat(renderer.render(call("asin", X))).isEqualTo("\\arcsin\\left(x\\right)");
        assertThat(renderer.render(call("sqrt", X))).isEqualTo("\\sqrt{x}");
        assertThat(renderer.render(call("exp", X))).isEqualTo("e^{x}");
        assertThat(renderer.render(call("abs", X))).isEqualTo("\\left|x\\right|");
        assertThat(renderer.render(var("pi"))).isEqualTo("\\pi");
    }

    @Test
    @DisplayName("unknown functions and unevaluated integrals")
    void specialCalls() {
        assertThat(renderer.render(call("gamma", X))).isEqualTo("\\operatorname{gamma}\\left(x\\right)");
        assertThat(renderer.render(call("integral", pow(X, num(2)), X))).isEqualTo("\\int x^{2} \\, dx");
    }
}

package io.casengine.core.spi;

import io.casengine.core.model.Expr;

/** Renders an expression tree as LaTeX. Implementations MUST be thread-safe. */
public interface LatexRenderer {

    String render(Expr expr);
}

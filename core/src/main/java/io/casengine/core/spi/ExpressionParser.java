package io.casengine.core.spi;

import io.casengine.core.model.ParseResult;

/**
 * Turns expression text into a validated tree. The engine never inspects raw text itself; every
 * entry point goes through this collaborator first.
 *
 * <p>Implementations MUST be stateless and thread-safe, and MUST report malformed input through
 * {@link ParseResult#valid()} rather than by throwing.
 */
public interface ExpressionParser {

    /**
     * Parses the given text.
     *
     * @param text the expression or equation source, e.g. {@code "2x + 3 = 7"}
     * @return a valid result carrying the tree, or an invalid one carrying the errors
     */
    ParseResult parse(String text);
}

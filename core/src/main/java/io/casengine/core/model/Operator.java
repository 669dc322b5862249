package io.casengine.core.model;

/**
 * Binary operators of the expression tree. Precedence drives both parsing and the parenthesisation
 * performed by {@link ExpressionFormatter}.
 */
public enum Operator {
    ADD("+", 1),
    SUB("-", 1),
    MUL("*", 2),
    DIV("/", 2),
    POW("^", 3);

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /** The infix symbol, e.g. {@code "+"}. */
    public String symbol() {
        return symbol;
    }

    /** Binding strength; higher binds tighter. */
    public int precedence() {
        return precedence;
    }

    /** {@code true} for operators where {@code (a op b) op c == a op (b op c)}. */
    public boolean isAssociative() {
        return this == ADD || this == MUL;
    }

    /**
     * Resolves an operator from its infix symbol.
     *
     * @throws IllegalArgumentException if the symbol is not a binary operator
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator symbol: '" + symbol + "'");
    }
}

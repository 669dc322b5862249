package io.casengine.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree node. The hierarchy is sealed: every node kind is known at compile
 * time, and each rewriting component dispatches over exactly these five variants.
 *
 * <p>
 * Equality is structural (deep value comparison of the records), which is what the simplifier
 * uses to detect a fixpoint. Subtrees are shared between trees, never copied or mutated.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Expr {

    /** Direct children in left-to-right order; empty for leaves. */
    List<Expr> children();

    /**
     * Returns a node of the same kind with the given children. Returns {@code this} when the
     * children are identical to the current ones.
     *
     * @throws IllegalArgumentException if the number of children does not match the node kind
     */
    Expr withChildren(List<Expr> children);

    /** Returns {@code true} if a {@link Var} with the given name occurs anywhere in this tree. */
    default boolean contains(String variable) {
        if (this instanceof Var v) {
            return v.name().equals(variable);
        }
        for (Expr child : children()) {
            if (child.contains(variable)) {
                return true;
            }
        }
        return false;
    }

    /** Number of nodes in this tree. */
    default int size() {
        int size = 1;
        for (Expr child : children()) {
            size += child.size();
        }
        return size;
    }

    // ── Factories ──

    static Num num(double value) {
        return new Num(value);
    }

    static Var var(String name) {
        return new Var(name);
    }

    static BinaryOp add(Expr left, Expr right) {
        return new BinaryOp(Operator.ADD, left, right);
    }

    static BinaryOp sub(Expr left, Expr right) {
        return new BinaryOp(Operator.SUB, left, right);
    }

    static BinaryOp mul(Expr left, Expr right) {
        return new BinaryOp(Operator.MUL, left, right);
    }

    static BinaryOp div(Expr left, Expr right) {
        return new BinaryOp(Operator.DIV, left, right);
    }

    static BinaryOp pow(Expr base, Expr exponent) {
        return new BinaryOp(Operator.POW, base, exponent);
    }

    /** {@code -1 * operand}; the tree has no unary minus node. */
    static BinaryOp neg(Expr operand) {
        return new BinaryOp(Operator.MUL, new Num(-1), operand);
    }

    static Call call(String name, Expr... args) {
        return new Call(name, Arrays.asList(args));
    }

    // ── Variants ──

    /**
     * A numeric literal. Must be finite; {@code -0.0} is normalised to {@code 0.0} so that
     * structural equality treats both zeros alike.
     */
    record Num(double value) implements Expr {
        public Num {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Number must be finite, got: " + value);
            }
            if (value == 0.0) {
                value = 0.0;
            }
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public Expr withChildren(List<Expr> children) {
            requireArity(children, 0, "Num");
            return this;
        }

        @Override
        public String toString() {
            return ExpressionFormatter.format(this);
        }
    }

    /** A named symbol, e.g. {@code x}, {@code pi}, or the integration constant {@code C}. */
    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Variable name must not be empty");
            }
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public Expr withChildren(List<Expr> children) {
            requireArity(children, 0, "Var");
            return this;
        }

        @Override
        public String toString() {
            return ExpressionFormatter.format(this);
        }
    }

    /** A binary operator application. */
    record BinaryOp(Operator op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }

        @Override
        public Expr withChildren(List<Expr> children) {
            requireArity(children, 2, "BinaryOp");
            if (children.get(0) == left && children.get(1) == right) {
                return this;
            }
            return new BinaryOp(op, children.get(0), children.get(1));
        }

        public boolean is(Operator operator) {
            return op == operator;
        }

        @Override
        public String toString() {
            return ExpressionFormatter.format(this);
        }
    }

    /**
     * A named function application such as {@code sin(x)}. The name is not validated here: an
     * unknown function is a legal tree, and components that have no rule for it say so.
     */
    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }

        /** The single argument of a unary function. */
        public Expr arg() {
            if (args.size() != 1) {
                throw new IllegalStateException(name + " takes " + args.size() + " arguments, not 1");
            }
            return args.get(0);
        }

        public boolean isUnary(String functionName) {
            return name.equals(functionName) && args.size() == 1;
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        public Expr withChildren(List<Expr> children) {
            requireArity(children, args.size(), "Call " + name);
            for (int i = 0; i < args.size(); i++) {
                if (children.get(i) != args.get(i)) {
                    return new Call(name, new ArrayList<>(children));
                }
            }
            return this;
        }

        @Override
        public String toString() {
            return ExpressionFormatter.format(this);
        }
    }

    /** An equation {@code lhs = rhs}; only valid at the root of a tree. */
    record Equation(Expr lhs, Expr rhs) implements Expr {
        public Equation {
            Objects.requireNonNull(lhs, "lhs must not be null");
            Objects.requireNonNull(rhs, "rhs must not be null");
        }

        @Override
        public List<Expr> children() {
            return List.of(lhs, rhs);
        }

        @Override
        public Expr withChildren(List<Expr> children) {
            requireArity(children, 2, "Equation");
            if (children.get(0) == lhs && children.get(1) == rhs) {
                return this;
            }
            return new Equation(children.get(0), children.get(1));
        }

        @Override
        public String toString() {
            return ExpressionFormatter.format(this);
        }
    }

    private static void requireArity(List<Expr> children, int expected, String kind) {
        Objects.requireNonNull(children, "children must not be null");
        if (children.size() != expected) {
            throw new IllegalArgumentException(
                    kind + " expects " + expected + " children, got: " + children.size());
        }
    }
}

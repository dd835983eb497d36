package io.stencil.core.render;

/// Comparators understood in `{% if %}` expressions, declared in scan order.
///
/// The evaluator splits an expression at the first operator of this list that occurs anywhere
/// in it, so `>=` is found before `>` and `<=` before `<`.
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    GTE(">="),
    LTE("<="),
    GT(">"),
    LT("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /// Returns whether this operator is an ordering comparison.
    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    /// Applies this operator to the result of a `compareTo`-style comparison.
    ///
    /// @param comparison negative, zero or positive
    /// @return the outcome of `left OP right`
    public boolean matches(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case GTE -> comparison >= 0;
            case LTE -> comparison <= 0;
            case GT -> comparison > 0;
            case LT -> comparison < 0;
        };
    }
}

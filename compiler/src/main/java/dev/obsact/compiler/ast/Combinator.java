package dev.obsact.compiler.ast;

/**
 * Joins one comparison of a condition to the next.
 */
public enum Combinator {
    AND("&&"),
    OR("||");

    private final String symbol;

    Combinator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

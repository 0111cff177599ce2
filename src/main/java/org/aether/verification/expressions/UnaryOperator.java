package org.aether.verification.expressions;

public enum UnaryOperator {
    NEG("-"),
    NOT("!"),
    BIT_NOT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}

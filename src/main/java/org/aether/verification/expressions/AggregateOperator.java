package org.aether.verification.expressions;

public enum AggregateOperator {
    SUM("sum"),
    PRODUCT("product"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    ALL("all"),
    ANY("any"),
    AVERAGE("avg");

    private final String keyword;

    AggregateOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}

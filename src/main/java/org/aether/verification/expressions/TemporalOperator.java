package org.aether.verification.expressions;

/**
 * 用于不变量的时序运算符。
 */
public enum TemporalOperator {
    ALWAYS("always"),
    EVENTUALLY("eventually"),
    UNTIL("until"),
    SINCE("since"),
    NEXT("next");

    private final String keyword;

    TemporalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}

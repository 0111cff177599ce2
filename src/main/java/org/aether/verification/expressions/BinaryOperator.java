package org.aether.verification.expressions;

public enum BinaryOperator {

    // 算术
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("%", Category.ARITHMETIC),

    // 比较
    EQ("==", Category.COMPARISON),
    NE("!=", Category.COMPARISON),
    LT("<", Category.COMPARISON),
    LE("<=", Category.COMPARISON),
    GT(">", Category.COMPARISON),
    GE(">=", Category.COMPARISON),

    // 逻辑
    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL),
    IMPLIES("==>", Category.LOGICAL),

    // 位运算
    BIT_AND("&", Category.BITWISE),
    BIT_OR("|", Category.BITWISE),
    BIT_XOR("^", Category.BITWISE);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL,
        BITWISE
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public Category getCategory() {
        return category;
    }
}

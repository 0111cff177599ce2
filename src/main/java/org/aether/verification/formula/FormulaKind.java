package org.aether.verification.formula;

/**
 * 公式节点种类。
 */
public enum FormulaKind {
    // 常量与变量
    BOOL_CONST,
    INT_CONST,
    REAL_CONST,
    VAR,

    // 比较
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,

    // 算术
    ADD,
    SUB,
    MUL,
    DIV,
    MOD,

    // 布尔连接词
    AND,
    OR,
    NOT,
    IMPLIES,
    ITE,

    // 量词
    FORALL,
    EXISTS,

    // 数组
    SELECT,
    STORE;

    public boolean isComparison() {
        return RelationType.fromFormulaKind(this) != null;
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
    }

    public boolean isQuantifier() {
        return this == FORALL || this == EXISTS;
    }

    public boolean isConstant() {
        return this == BOOL_CONST || this == INT_CONST || this == REAL_CONST;
    }
}

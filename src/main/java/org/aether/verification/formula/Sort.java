package org.aether.verification.formula;

/**
 * 求解器公式的排序（类型）。
 * ARRAY 表示 Int 到 Int 的数组。
 */
public enum Sort {
    INT("Int"),
    REAL("Real"),
    BOOL("Bool"),
    ARRAY("(Array Int Int)");

    private final String smtName;

    Sort(String smtName) {
        this.smtName = smtName;
    }

    public String getSmtName() {
        return smtName;
    }

    public boolean isArithmetic() {
        return this == INT || this == REAL;
    }

    /**
     * 两个算术排序的公共上界：任一为 REAL 则结果为 REAL。
     */
    public static Sort join(Sort a, Sort b) {
        if (!a.isArithmetic() || !b.isArithmetic()) {
            throw new IllegalArgumentException("只能合并算术排序: " + a + " 和 " + b);
        }
        return (a == REAL || b == REAL) ? REAL : INT;
    }
}

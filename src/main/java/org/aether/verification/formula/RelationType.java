package org.aether.verification.formula;

public enum RelationType {

    /**
     * 比较运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("="),    // Equal
    NE("!=");   // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NE;
            case NE -> EQ;
        };
    }

    /**
     * 对应的公式节点种类。
     */
    public FormulaKind toFormulaKind() {
        return switch (this) {
            case LT -> FormulaKind.LT;
            case LE -> FormulaKind.LE;
            case GT -> FormulaKind.GT;
            case GE -> FormulaKind.GE;
            case EQ -> FormulaKind.EQ;
            case NE -> FormulaKind.NE;
        };
    }

    /**
     * 公式节点种类对应的关系类型，非比较节点返回 null。
     */
    public static RelationType fromFormulaKind(FormulaKind kind) {
        return switch (kind) {
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            case EQ -> EQ;
            case NE -> NE;
            default -> null;
        };
    }
}

package org.aether.verification.mir;

public enum MirBinaryOp {
    ADD,
    SUB,
    MUL,
    DIV,
    REM,
    MOD,
    BIT_XOR,
    BIT_AND,
    BIT_OR,
    SHL,
    SHR,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    AND,
    OR,
    OFFSET;

    /**
     * 除数为零时会出错的运算。
     */
    public boolean isDivision() {
        return this == DIV || this == REM || this == MOD;
    }

    /**
     * 位运算、移位和指针偏移在公式中只作为不透明值出现。
     */
    public boolean isOpaque() {
        switch (this) {
            case BIT_XOR:
            case BIT_AND:
            case BIT_OR:
            case SHL:
            case SHR:
            case OFFSET:
                return true;
            default:
                return false;
        }
    }
}

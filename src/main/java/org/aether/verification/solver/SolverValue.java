package org.aether.verification.solver;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * 模型中一个常量的取值。
 * 此类是不可变的。
 */
@Getter
public final class SolverValue {

    public enum Kind {
        INTEGER,
        REAL,
        BOOLEAN,
        STRING,
        ARRAY,
        UNKNOWN
    }

    private final Kind kind;
    // BigInteger、BigDecimal、Boolean 或 String
    private final Object value;

    private SolverValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "Value cannot be null.");
    }

    public static SolverValue ofInteger(BigInteger value) {
        return new SolverValue(Kind.INTEGER, value);
    }

    public static SolverValue ofInteger(long value) {
        return ofInteger(BigInteger.valueOf(value));
    }

    public static SolverValue ofReal(BigDecimal value) {
        return new SolverValue(Kind.REAL, value);
    }

    public static SolverValue ofBoolean(boolean value) {
        return new SolverValue(Kind.BOOLEAN, value);
    }

    public static SolverValue ofString(String value) {
        return new SolverValue(Kind.STRING, value);
    }

    /**
     * 数组取值以求解器给出的文本形式保存。
     */
    public static SolverValue ofArray(String text) {
        return new SolverValue(Kind.ARRAY, text);
    }

    public static SolverValue unknown(String text) {
        return new SolverValue(Kind.UNKNOWN, text);
    }

    public BigInteger getIntegerValue() {
        if (kind != Kind.INTEGER) {
            throw new IllegalStateException("不是整数取值: " + this);
        }
        return (BigInteger) value;
    }

    public BigDecimal getRealValue() {
        if (kind != Kind.REAL) {
            throw new IllegalStateException("不是实数取值: " + this);
        }
        return (BigDecimal) value;
    }

    public boolean getBooleanValue() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("不是布尔取值: " + this);
        }
        return (Boolean) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SolverValue that = (SolverValue) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        if (kind == Kind.REAL) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 契约中的常量：Integer、Float、Boolean、String 或 Null。
 * 此类是不可变的。
 */
@Getter
public final class Constant extends ContractExpression {

    public static final Constant NULL = new Constant(ConstantKind.NULL, null);

    private final ConstantKind kind;
    // Long、Double、Boolean、String，NULL 时为 null
    private final Object value;

    private Constant(ConstantKind kind, Object value) {
        this.kind = Objects.requireNonNull(kind, "Constant kind cannot be null.");
        this.value = value;
    }

    public static Constant ofInteger(long value) {
        return new Constant(ConstantKind.INTEGER, value);
    }

    public static Constant ofFloat(double value) {
        return new Constant(ConstantKind.FLOAT, value);
    }

    public static Constant ofBoolean(boolean value) {
        return new Constant(ConstantKind.BOOLEAN, value);
    }

    public static Constant ofString(String value) {
        return new Constant(ConstantKind.STRING, Objects.requireNonNull(value, "String constant cannot be null."));
    }

    public long getIntegerValue() {
        requireKind(ConstantKind.INTEGER);
        return (Long) value;
    }

    public double getFloatValue() {
        requireKind(ConstantKind.FLOAT);
        return (Double) value;
    }

    public boolean getBooleanValue() {
        requireKind(ConstantKind.BOOLEAN);
        return (Boolean) value;
    }

    public String getStringValue() {
        requireKind(ConstantKind.STRING);
        return (String) value;
    }

    private void requireKind(ConstantKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("常量 " + this + " 不是 " + expected);
        }
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant that = (Constant) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == ConstantKind.NULL ? "null" : String.valueOf(value);
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 量词约束的变量及其声明类型。
 */
@Getter
public final class BoundVariable {

    private final String name;
    private final ValueType type;

    private BoundVariable(String name, ValueType type) {
        this.name = Objects.requireNonNull(name, "Bound variable name cannot be null.");
        this.type = Objects.requireNonNull(type, "Bound variable type cannot be null.");
    }

    public static BoundVariable of(String name, ValueType type) {
        return new BoundVariable(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BoundVariable that = (BoundVariable) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}

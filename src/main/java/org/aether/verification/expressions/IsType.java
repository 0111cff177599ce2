package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class IsType extends ContractExpression {

    private final ContractExpression expression;
    private final ValueType type;

    private IsType(ContractExpression expression, ValueType type) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null.");
        this.type = Objects.requireNonNull(type, "Type cannot be null.");
    }

    public static IsType of(ContractExpression expression, ValueType type) {
        return new IsType(expression, type);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitIsType(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IsType that = (IsType) o;
        return expression.equals(that.expression) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, type);
    }

    @Override
    public String toString() {
        return "is_type(" + expression + ", " + type.getDisplayName() + ")";
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Length extends ContractExpression {

    private final ContractExpression expression;

    private Length(ContractExpression expression) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null.");
    }

    public static Length of(ContractExpression expression) {
        return new Length(expression);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitLength(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return expression.equals(((Length) o).expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Length.class, expression);
    }

    @Override
    public String toString() {
        return "len(" + expression + ")";
    }
}

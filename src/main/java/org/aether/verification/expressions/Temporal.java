package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Temporal extends ContractExpression {

    private final TemporalOperator operator;
    private final ContractExpression expression;

    private Temporal(TemporalOperator operator, ContractExpression expression) {
        this.operator = Objects.requireNonNull(operator, "Temporal operator cannot be null.");
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null.");
    }

    public static Temporal of(TemporalOperator operator, ContractExpression expression) {
        return new Temporal(operator, expression);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitTemporal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Temporal that = (Temporal) o;
        return operator == that.operator && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, expression);
    }

    @Override
    public String toString() {
        return operator.getKeyword() + " " + expression;
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class UnaryOperation extends ContractExpression {

    private final UnaryOperator operator;
    private final ContractExpression operand;

    private UnaryOperation(UnaryOperator operator, ContractExpression operand) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null.");
        this.operand = Objects.requireNonNull(operand, "Operand cannot be null.");
    }

    public static UnaryOperation of(UnaryOperator operator, ContractExpression operand) {
        return new UnaryOperation(operator, operand);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitUnaryOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryOperation that = (UnaryOperation) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + " " + operand + ")";
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class BinaryOperation extends ContractExpression {

    private final BinaryOperator operator;
    private final ContractExpression left;
    private final ContractExpression right;

    private final int hashCode;

    private BinaryOperation(BinaryOperator operator, ContractExpression left, ContractExpression right) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null.");
        this.left = Objects.requireNonNull(left, "Left operand cannot be null.");
        this.right = Objects.requireNonNull(right, "Right operand cannot be null.");
        this.hashCode = Objects.hash(operator, left, right);
    }

    public static BinaryOperation of(BinaryOperator operator, ContractExpression left, ContractExpression right) {
        return new BinaryOperation(operator, left, right);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitBinaryOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryOperation that = (BinaryOperation) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}

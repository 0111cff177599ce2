package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * old(expr)：表达式在函数入口处的值，只在后置条件中有意义。
 */
@Getter
public final class Old extends ContractExpression {

    private final ContractExpression expression;

    private Old(ContractExpression expression) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null.");
    }

    public static Old of(ContractExpression expression) {
        return new Old(expression);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitOld(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return expression.equals(((Old) o).expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Old.class, expression);
    }

    @Override
    public String toString() {
        return "old(" + expression + ")";
    }
}

package org.aether.verification.expressions;

/**
 * 后置条件中返回值的占位符。单例。
 */
public final class ResultValue extends ContractExpression {

    public static final ResultValue INSTANCE = new ResultValue();

    private ResultValue() {
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitResult(this);
    }

    @Override
    public String toString() {
        return "result";
    }
}

package org.aether.verification.contract;

import org.aether.verification.expressions.*;

/**
 * 常见不变量的构造辅助。
 */
public final class InvariantPatterns {

    private InvariantPatterns() {
    }

    /**
     * 0 <= index < length
     */
    public static ContractExpression arrayBounds(String indexVariable, ContractExpression length) {
        Variable index = Variable.of(indexVariable);
        return BinaryOperation.of(BinaryOperator.AND,
                BinaryOperation.of(BinaryOperator.LE, Constant.ofInteger(0), index),
                BinaryOperation.of(BinaryOperator.LT, index, length));
    }

    public static ContractExpression nonNull(String variable) {
        return BinaryOperation.of(BinaryOperator.NE, Variable.of(variable), Constant.NULL);
    }

    /**
     * low <= variable <= high
     */
    public static ContractExpression inRange(String variable, long low, long high) {
        Variable v = Variable.of(variable);
        return BinaryOperation.of(BinaryOperator.AND,
                BinaryOperation.of(BinaryOperator.LE, Constant.ofInteger(low), v),
                BinaryOperation.of(BinaryOperator.LE, v, Constant.ofInteger(high)));
    }
}

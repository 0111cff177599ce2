package org.aether.verification.expressions;

import java.util.List;

/**
 * 契约谓词的类型化表达式树。
 * 所有子类都是不可变的，树中没有环，每个条件独占自己的表达式树。
 * 通过 {@link ContractExpressionVisitor} 做双分派。
 */
public abstract class ContractExpression {

    ContractExpression() {
    }

    public abstract <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E;

    /**
     * 将一组表达式组合为合取：空列表为 true，单个表达式为其自身，否则左结合地用 And 连接。
     * @param expressions 要合取的表达式。
     * @return 合取表达式。
     */
    public static ContractExpression conjunction(List<ContractExpression> expressions) {
        if (expressions.isEmpty()) {
            return Constant.ofBoolean(true);
        }
        ContractExpression result = expressions.get(0);
        for (int i = 1; i < expressions.size(); i++) {
            result = BinaryOperation.of(BinaryOperator.AND, result, expressions.get(i));
        }
        return result;
    }
}

package org.aether.verification.expressions;

/**
 * 契约表达式的访问者，每种变体一个方法。
 * @param <R> 访问结果类型。
 * @param <E> 访问过程中可能抛出的异常类型。
 */
public interface ContractExpressionVisitor<R, E extends Exception> {

    R visitVariable(Variable expr) throws E;

    R visitConstant(Constant expr) throws E;

    R visitBinaryOperation(BinaryOperation expr) throws E;

    R visitUnaryOperation(UnaryOperation expr) throws E;

    R visitFunctionCall(FunctionCall expr) throws E;

    R visitArrayAccess(ArrayAccess expr) throws E;

    R visitFieldAccess(FieldAccess expr) throws E;

    R visitQuantifier(Quantifier expr) throws E;

    R visitOld(Old expr) throws E;

    R visitResult(ResultValue expr) throws E;

    R visitLength(Length expr) throws E;

    R visitIsType(IsType expr) throws E;

    R visitSemanticPredicate(SemanticPredicate expr) throws E;

    R visitTemporal(Temporal expr) throws E;

    R visitInSet(InSet expr) throws E;

    R visitRange(Range expr) throws E;

    R visitMatches(Matches expr) throws E;

    R visitAggregate(Aggregate expr) throws E;

    R visitLet(Let expr) throws E;
}

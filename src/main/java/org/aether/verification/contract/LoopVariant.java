package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.expressions.ContractExpression;

import java.util.Objects;

/**
 * 循环变式：每次迭代严格减小，且不低于下界。
 */
@Getter
public final class LoopVariant {

    private final ContractExpression expression;
    private final ContractExpression lowerBound;

    public LoopVariant(ContractExpression expression, ContractExpression lowerBound) {
        this.expression = Objects.requireNonNull(expression, "Variant expression cannot be null.");
        this.lowerBound = Objects.requireNonNull(lowerBound, "Lower bound cannot be null.");
    }

    @Override
    public String toString() {
        return "decreases " + expression + " >= " + lowerBound;
    }
}

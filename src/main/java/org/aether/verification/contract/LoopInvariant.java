package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.expressions.ContractExpression;

import java.util.*;

/**
 * 附加在循环头基本块上的不变量，以及可选的循环变式。
 */
@Getter
public final class LoopInvariant {

    private final int loopHeader;
    private final List<InvariantCondition> conditions = new ArrayList<>();
    // 可为 null
    private LoopVariant variant;

    public LoopInvariant(int loopHeader) {
        if (loopHeader < 0) {
            throw new IllegalArgumentException("循环头块编号不能为负: " + loopHeader);
        }
        this.loopHeader = loopHeader;
    }

    public LoopInvariant addCondition(String name, ContractExpression expression, SourceLocation location) {
        conditions.add(new InvariantCondition(name, expression, location));
        return this;
    }

    public LoopInvariant setVariant(ContractExpression expression, ContractExpression lowerBound) {
        this.variant = new LoopVariant(expression, lowerBound);
        return this;
    }

    public boolean hasVariant() {
        return variant != null;
    }

    public Optional<LoopVariant> getVariant() {
        return Optional.ofNullable(variant);
    }

    public List<InvariantCondition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    @Override
    public String toString() {
        return "LoopInvariant{bb" + loopHeader + ", " + conditions + (variant != null ? ", " + variant : "") + "}";
    }
}

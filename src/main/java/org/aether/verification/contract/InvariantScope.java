package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.expressions.ContractExpression;

import java.util.Objects;

/**
 * 全局不变量的生效范围。
 */
@Getter
public final class InvariantScope {

    public enum Kind {
        ALWAYS,
        FUNCTION,
        MODULE,
        CONDITIONAL
    }

    public static final InvariantScope ALWAYS = new InvariantScope(Kind.ALWAYS, null, null);

    private final Kind kind;
    // FUNCTION / MODULE 的名称
    private final String name;
    // CONDITIONAL 的条件
    private final ContractExpression condition;

    private InvariantScope(Kind kind, String name, ContractExpression condition) {
        this.kind = kind;
        this.name = name;
        this.condition = condition;
    }

    public static InvariantScope function(String name) {
        return new InvariantScope(Kind.FUNCTION, Objects.requireNonNull(name, "Function name cannot be null."), null);
    }

    public static InvariantScope module(String name) {
        return new InvariantScope(Kind.MODULE, Objects.requireNonNull(name, "Module name cannot be null."), null);
    }

    public static InvariantScope conditional(ContractExpression condition) {
        return new InvariantScope(Kind.CONDITIONAL, null, Objects.requireNonNull(condition, "Condition cannot be null."));
    }

    @Override
    public String toString() {
        switch (kind) {
            case FUNCTION:
            case MODULE:
                return kind.name() + "(" + name + ")";
            case CONDITIONAL:
                return "CONDITIONAL(" + condition + ")";
            default:
                return "ALWAYS";
        }
    }
}

package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.expressions.ContractExpression;

import java.util.Objects;

/**
 * 在整个执行过程中都应成立的不变量。
 * VC 生成器在入口处假设它，在返回处检查它。
 */
@Getter
public final class GlobalInvariant {

    private final String name;
    private final ContractExpression expression;
    private final InvariantScope scope;
    private final SourceLocation location;

    public GlobalInvariant(String name, ContractExpression expression, InvariantScope scope, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "Invariant name cannot be null.");
        this.expression = Objects.requireNonNull(expression, "Invariant expression cannot be null.");
        this.scope = Objects.requireNonNull(scope, "Scope cannot be null.");
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
    }

    /**
     * FUNCTION 范围按函数名匹配；模块与条件范围目前在所有函数中生效。
     */
    public boolean appliesInFunction(String functionName) {
        if (scope.getKind() == InvariantScope.Kind.FUNCTION) {
            return scope.getName().equals(functionName);
        }
        return true;
    }

    @Override
    public String toString() {
        return name + " [" + scope + "]: " + expression;
    }
}

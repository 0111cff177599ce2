package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.expressions.ContractExpression;

import java.util.Objects;

@Getter
public final class InvariantCondition {

    private final String name;
    private final ContractExpression expression;
    private final SourceLocation location;

    public InvariantCondition(String name, ContractExpression expression, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "Invariant name cannot be null.");
        this.expression = Objects.requireNonNull(expression, "Invariant expression cannot be null.");
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
    }

    @Override
    public String toString() {
        return name + ": " + expression;
    }
}

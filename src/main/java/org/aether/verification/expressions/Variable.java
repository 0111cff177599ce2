package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Variable extends ContractExpression {

    private final String name;

    private Variable(String name) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}

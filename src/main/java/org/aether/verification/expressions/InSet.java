package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class InSet extends ContractExpression {

    private final ContractExpression element;
    private final ContractExpression set;

    private InSet(ContractExpression element, ContractExpression set) {
        this.element = Objects.requireNonNull(element, "Element cannot be null.");
        this.set = Objects.requireNonNull(set, "Set cannot be null.");
    }

    public static InSet of(ContractExpression element, ContractExpression set) {
        return new InSet(element, set);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitInSet(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InSet that = (InSet) o;
        return element.equals(that.element) && set.equals(that.set);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, set);
    }

    @Override
    public String toString() {
        return element + " in " + set;
    }
}

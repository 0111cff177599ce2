package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class ArrayAccess extends ContractExpression {

    private final ContractExpression array;
    private final ContractExpression index;

    private ArrayAccess(ContractExpression array, ContractExpression index) {
        this.array = Objects.requireNonNull(array, "Array cannot be null.");
        this.index = Objects.requireNonNull(index, "Index cannot be null.");
    }

    public static ArrayAccess of(ContractExpression array, ContractExpression index) {
        return new ArrayAccess(array, index);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitArrayAccess(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArrayAccess that = (ArrayAccess) o;
        return array.equals(that.array) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(array, index);
    }

    @Override
    public String toString() {
        return array + "[" + index + "]";
    }
}

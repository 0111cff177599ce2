package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class FieldAccess extends ContractExpression {

    private final ContractExpression object;
    private final String field;

    private FieldAccess(ContractExpression object, String field) {
        this.object = Objects.requireNonNull(object, "Object cannot be null.");
        this.field = Objects.requireNonNull(field, "Field cannot be null.");
    }

    public static FieldAccess of(ContractExpression object, String field) {
        return new FieldAccess(object, field);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitFieldAccess(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldAccess that = (FieldAccess) o;
        return object.equals(that.object) && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(object, field);
    }

    @Override
    public String toString() {
        return object + "." + field;
    }
}

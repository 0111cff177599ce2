package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Range extends ContractExpression {

    private final ContractExpression start;
    private final ContractExpression end;
    private final boolean inclusive;

    private Range(ContractExpression start, ContractExpression end, boolean inclusive) {
        this.start = Objects.requireNonNull(start, "Range start cannot be null.");
        this.end = Objects.requireNonNull(end, "Range end cannot be null.");
        this.inclusive = inclusive;
    }

    public static Range of(ContractExpression start, ContractExpression end, boolean inclusive) {
        return new Range(start, end, inclusive);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Range that = (Range) o;
        return inclusive == that.inclusive && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, inclusive);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + (inclusive ? "]" : ")");
    }
}

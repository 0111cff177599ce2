package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 集合上的聚合运算，可带一个过滤谓词，例如 all(array | x > 0)。
 */
@Getter
public final class Aggregate extends ContractExpression {

    private final AggregateOperator operator;
    private final ContractExpression collection;
    // 可为 null
    private final ContractExpression filter;

    private Aggregate(AggregateOperator operator, ContractExpression collection, ContractExpression filter) {
        this.operator = Objects.requireNonNull(operator, "Aggregate operator cannot be null.");
        this.collection = Objects.requireNonNull(collection, "Collection cannot be null.");
        this.filter = filter;
    }

    public static Aggregate of(AggregateOperator operator, ContractExpression collection) {
        return new Aggregate(operator, collection, null);
    }

    public static Aggregate of(AggregateOperator operator, ContractExpression collection, ContractExpression filter) {
        return new Aggregate(operator, collection, Objects.requireNonNull(filter, "Filter cannot be null."));
    }

    public Optional<ContractExpression> getFilter() {
        return Optional.ofNullable(filter);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitAggregate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Aggregate that = (Aggregate) o;
        return operator == that.operator && collection.equals(that.collection) && Objects.equals(filter, that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, collection, filter);
    }

    @Override
    public String toString() {
        if (filter == null) {
            return operator.getKeyword() + "(" + collection + ")";
        }
        return operator.getKeyword() + "(" + collection + " | " + filter + ")";
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 具名的领域谓词，例如 is_valid_email(email)。
 * 在求解之前需要展开为它的定义。
 */
@Getter
public final class SemanticPredicate extends ContractExpression {

    private final String predicate;
    private final List<ContractExpression> arguments;

    private SemanticPredicate(String predicate, List<ContractExpression> arguments) {
        this.predicate = Objects.requireNonNull(predicate, "Predicate name cannot be null.");
        this.arguments = List.copyOf(arguments);
    }

    public static SemanticPredicate of(String predicate, List<ContractExpression> arguments) {
        return new SemanticPredicate(predicate, arguments);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitSemanticPredicate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SemanticPredicate that = (SemanticPredicate) o;
        return predicate.equals(that.predicate) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, arguments);
    }

    @Override
    public String toString() {
        return predicate + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}

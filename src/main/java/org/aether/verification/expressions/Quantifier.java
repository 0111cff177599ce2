package org.aether.verification.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 全称或存在量词，形如 forall x, y. body。
 */
@Getter
public final class Quantifier extends ContractExpression {

    private final QuantifierKind kind;
    private final List<BoundVariable> variables;
    private final ContractExpression body;

    private Quantifier(QuantifierKind kind, List<BoundVariable> variables, ContractExpression body) {
        this.kind = Objects.requireNonNull(kind, "Quantifier kind cannot be null.");
        this.variables = List.copyOf(variables);
        this.body = Objects.requireNonNull(body, "Quantifier body cannot be null.");
    }

    public static Quantifier forall(List<BoundVariable> variables, ContractExpression body) {
        return new Quantifier(QuantifierKind.FORALL, variables, body);
    }

    public static Quantifier exists(List<BoundVariable> variables, ContractExpression body) {
        return new Quantifier(QuantifierKind.EXISTS, variables, body);
    }

    public static Quantifier of(QuantifierKind kind, List<BoundVariable> variables, ContractExpression body) {
        return new Quantifier(kind, variables, body);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitQuantifier(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Quantifier that = (Quantifier) o;
        return kind == that.kind && variables.equals(that.variables) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, variables, body);
    }

    @Override
    public String toString() {
        String vars = variables.stream().map(BoundVariable::getName).collect(Collectors.joining(", "));
        return kind.getKeyword() + " " + vars + ". " + body;
    }
}

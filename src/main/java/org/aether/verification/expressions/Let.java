package org.aether.verification.expressions;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 局部定义：let a = e1, b = e2 in body。
 * 绑定按顺序生效，后面的绑定可以引用前面的名称。
 */
@Getter
public final class Let extends ContractExpression {

    private final List<Pair<String, ContractExpression>> bindings;
    private final ContractExpression body;

    private Let(List<Pair<String, ContractExpression>> bindings, ContractExpression body) {
        Objects.requireNonNull(bindings, "Bindings cannot be null.");
        for (Pair<String, ContractExpression> binding : bindings) {
            Objects.requireNonNull(binding.getKey(), "Binding name cannot be null.");
            Objects.requireNonNull(binding.getValue(), "Binding expression cannot be null.");
        }
        this.bindings = List.copyOf(bindings);
        this.body = Objects.requireNonNull(body, "Let body cannot be null.");
    }

    public static Let of(List<Pair<String, ContractExpression>> bindings, ContractExpression body) {
        return new Let(bindings, body);
    }

    public static Let of(String name, ContractExpression value, ContractExpression body) {
        return new Let(List.of(Pair.of(name, value)), body);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitLet(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Let that = (Let) o;
        return bindings.equals(that.bindings) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, body);
    }

    @Override
    public String toString() {
        String bound = bindings.stream()
                .map(b -> b.getKey() + " = " + b.getValue())
                .collect(Collectors.joining(", "));
        return "let " + bound + " in " + body;
    }
}

package org.aether.verification.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 对纯函数的调用，只允许出现在契约中。
 */
@Getter
public final class FunctionCall extends ContractExpression {

    private final String function;
    private final List<ContractExpression> arguments;

    private FunctionCall(String function, List<ContractExpression> arguments) {
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        this.arguments = List.copyOf(arguments);
    }

    public static FunctionCall of(String function, List<ContractExpression> arguments) {
        return new FunctionCall(function, arguments);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionCall that = (FunctionCall) o;
        return function.equals(that.function) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments);
    }

    @Override
    public String toString() {
        return function + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}

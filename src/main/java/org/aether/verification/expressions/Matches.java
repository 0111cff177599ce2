package org.aether.verification.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 字符串模式匹配谓词，需要字符串理论才能编码。
 */
@Getter
public final class Matches extends ContractExpression {

    private final ContractExpression expression;
    private final String pattern;

    private Matches(ContractExpression expression, String pattern) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null.");
        this.pattern = Objects.requireNonNull(pattern, "Pattern cannot be null.");
    }

    public static Matches of(ContractExpression expression, String pattern) {
        return new Matches(expression, pattern);
    }

    @Override
    public <R, E extends Exception> R accept(ContractExpressionVisitor<R, E> visitor) throws E {
        return visitor.visitMatches(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Matches that = (Matches) o;
        return expression.equals(that.expression) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, pattern);
    }

    @Override
    public String toString() {
        return expression + " matches \"" + pattern + "\"";
    }
}

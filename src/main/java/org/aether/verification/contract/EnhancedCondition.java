package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.expressions.ContractExpression;

import java.util.Objects;
import java.util.Optional;

/**
 * 带名称的契约条件，附带源码位置、可选的证明提示、失败动作和验证方式。
 * 此类是不可变的。
 */
@Getter
public final class EnhancedCondition {

    private final String name;
    private final ContractExpression expression;
    private final SourceLocation location;
    // 可为 null
    private final String proofHint;
    private final FailureAction failureAction;
    private final VerificationHint verificationHint;

    private EnhancedCondition(String name, ContractExpression expression, SourceLocation location, String proofHint,
                              FailureAction failureAction, VerificationHint verificationHint) {
        this.name = Objects.requireNonNull(name, "Condition name cannot be null.");
        this.expression = Objects.requireNonNull(expression, "Condition expression cannot be null.");
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.proofHint = proofHint;
        this.failureAction = Objects.requireNonNull(failureAction, "Failure action cannot be null.");
        this.verificationHint = Objects.requireNonNull(verificationHint, "Verification hint cannot be null.");
    }

    public static EnhancedCondition of(String name, ContractExpression expression, SourceLocation location, String proofHint,
                                       FailureAction failureAction, VerificationHint verificationHint) {
        return new EnhancedCondition(name, expression, location, proofHint, failureAction, verificationHint);
    }

    public Optional<String> getProofHint() {
        return Optional.ofNullable(proofHint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EnhancedCondition that = (EnhancedCondition) o;
        return name.equals(that.name)
                && expression.equals(that.expression)
                && location.equals(that.location)
                && Objects.equals(proofHint, that.proofHint)
                && failureAction.equals(that.failureAction)
                && verificationHint.equals(that.verificationHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression, location, proofHint, failureAction, verificationHint);
    }

    @Override
    public String toString() {
        return name + ": " + expression;
    }
}

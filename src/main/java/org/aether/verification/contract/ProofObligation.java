package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.expressions.ContractExpression;

import java.util.List;
import java.util.Objects;

/**
 * 从契约派生的证明义务，不依赖函数体即可检查。
 * 此类是不可变的。
 */
@Getter
public final class ProofObligation {

    private final String id;
    private final String description;
    private final ContractExpression formula;
    private final List<ContractExpression> assumptions;
    private final VerificationMethod method;
    private final VerificationPriority priority;

    public ProofObligation(String id, String description, ContractExpression formula, List<ContractExpression> assumptions,
                           VerificationMethod method, VerificationPriority priority) {
        this.id = Objects.requireNonNull(id, "Obligation id cannot be null.");
        this.description = Objects.requireNonNull(description, "Description cannot be null.");
        this.formula = Objects.requireNonNull(formula, "Formula cannot be null.");
        this.assumptions = List.copyOf(assumptions);
        this.method = Objects.requireNonNull(method, "Method cannot be null.");
        this.priority = Objects.requireNonNull(priority, "Priority cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProofObligation that = (ProofObligation) o;
        return id.equals(that.id)
                && description.equals(that.description)
                && formula.equals(that.formula)
                && assumptions.equals(that.assumptions)
                && method == that.method
                && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, formula, assumptions, method, priority);
    }

    @Override
    public String toString() {
        return id + " [" + priority + ", " + method + "]: " + formula;
    }
}

package org.aether.verification.engine;

import lombok.Getter;
import org.aether.verification.contract.VerificationMethod;

import java.util.List;
import java.util.Objects;

/**
 * 证明成功时记录的证明概要：步骤、用到的假设和方法。
 */
@Getter
public final class ProofCertificate {

    private final String conditionName;
    private final List<String> proofSteps;
    private final List<String> assumptionsUsed;
    private final VerificationMethod method;

    public ProofCertificate(String conditionName, List<String> proofSteps, List<String> assumptionsUsed,
                            VerificationMethod method) {
        this.conditionName = Objects.requireNonNull(conditionName, "Condition name cannot be null.");
        this.proofSteps = List.copyOf(proofSteps);
        this.assumptionsUsed = List.copyOf(assumptionsUsed);
        this.method = Objects.requireNonNull(method, "Method cannot be null.");
    }

    @Override
    public String toString() {
        return "ProofCertificate{" + conditionName + ", " + method + ", steps=" + proofSteps + "}";
    }
}

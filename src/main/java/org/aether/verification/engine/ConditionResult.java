package org.aether.verification.engine;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.solver.SatResult;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个验证条件的结论。
 */
@Getter
public final class ConditionResult {

    private final String name;
    private final String condition;
    private final ConditionStatus status;
    // 对否定式检查的答案
    private final SatResult satResult;
    private final SourceLocation location;
    private final long timeMs;
    // 可为 null
    private final ProofCertificate proofCertificate;

    public ConditionResult(String name, String condition, ConditionStatus status, SatResult satResult,
                           SourceLocation location, long timeMs, ProofCertificate proofCertificate) {
        this.name = Objects.requireNonNull(name, "Name cannot be null.");
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null.");
        this.status = Objects.requireNonNull(status, "Status cannot be null.");
        this.satResult = Objects.requireNonNull(satResult, "Sat result cannot be null.");
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.timeMs = timeMs;
        this.proofCertificate = proofCertificate;
    }

    /**
     * 按否定式的检查答案确定状态：UNSAT 为已证明，SAT 为被反驳，其余为未决。
     */
    public static ConditionStatus statusOf(SatResult negationResult) {
        switch (negationResult) {
            case UNSAT:
                return ConditionStatus.PROVED;
            case SAT:
                return ConditionStatus.REFUTED;
            default:
                return ConditionStatus.UNDECIDED;
        }
    }

    public boolean isVerified() {
        return status == ConditionStatus.PROVED;
    }

    public Optional<ProofCertificate> getProofCertificate() {
        return Optional.ofNullable(proofCertificate);
    }

    @Override
    public String toString() {
        return name + ": " + status + " (" + satResult + ", " + timeMs + " ms)";
    }
}

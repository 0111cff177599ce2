package org.aether.verification.engine;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个函数的验证报告。
 * verified 当且仅当没有错误且所有条件都已证明。
 */
@Getter
public final class VerificationResult {

    private final String function;
    private final boolean verified;
    private final List<ConditionResult> conditions;
    private final List<Counterexample> counterexamples;
    // 生成或求解阶段的错误，可为 null
    private final Exception error;

    private VerificationResult(String function, List<ConditionResult> conditions, List<Counterexample> counterexamples,
                               Exception error) {
        this.function = Objects.requireNonNull(function, "Function name cannot be null.");
        this.conditions = List.copyOf(conditions);
        this.counterexamples = List.copyOf(counterexamples);
        this.error = error;
        this.verified = error == null && this.conditions.stream().allMatch(ConditionResult::isVerified);
    }

    public static VerificationResult of(String function, List<ConditionResult> conditions,
                                        List<Counterexample> counterexamples) {
        return new VerificationResult(function, conditions, counterexamples, null);
    }

    public static VerificationResult failed(String function, Exception error) {
        return new VerificationResult(function, List.of(), List.of(),
                Objects.requireNonNull(error, "Error cannot be null."));
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<ConditionResult> getCondition(String name) {
        return conditions.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public long countWithStatus(ConditionStatus status) {
        return conditions.stream().filter(c -> c.getStatus() == status).count();
    }

    @Override
    public String toString() {
        if (error != null) {
            return function + ": error " + error.getMessage();
        }
        return function + ": " + (verified ? "verified" : "not verified") + " " + conditions;
    }
}

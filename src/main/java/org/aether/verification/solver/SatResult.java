package org.aether.verification.solver;

/**
 * 可满足性检查的答案。UNKNOWN 与 TIMEOUT 是合法答案，不是错误。
 */
public enum SatResult {
    SAT,
    UNSAT,
    UNKNOWN,
    TIMEOUT;

    public boolean isDecided() {
        return this == SAT || this == UNSAT;
    }
}

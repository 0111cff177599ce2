package org.aether.verification.engine;

public enum ConditionStatus {
    // 否定式 UNSAT
    PROVED,
    // 否定式 SAT，附反例
    REFUTED,
    // UNKNOWN 或 TIMEOUT
    UNDECIDED
}

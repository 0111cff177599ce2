package org.aether.verification.contract;

public enum VerificationMethod {
    DIRECT_PROOF,
    INDUCTION,
    CONTRADICTION,
    MODEL_CHECKING,
    SYMBOLIC_EXECUTION,
    Z3_SOLVER
}

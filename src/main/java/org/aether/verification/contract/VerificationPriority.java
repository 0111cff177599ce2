package org.aether.verification.contract;

public enum VerificationPriority {
    // 正确性必须
    CRITICAL,
    // 安全性应当
    HIGH,
    MEDIUM,
    LOW
}

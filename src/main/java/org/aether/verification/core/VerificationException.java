package org.aether.verification.core;

/**
 * 验证核心所有受检异常的基类。
 * 验证失败（VC 被反驳）不是异常，它被记录在验证结果中。
 */
public class VerificationException extends Exception {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

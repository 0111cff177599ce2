package org.aether.verification.core;

/**
 * 求解器后端故障：自身编码错误、排序不匹配、本地库崩溃等。
 * 与合法的 UNKNOWN / TIMEOUT 答案区分开。
 */
public class SolverException extends VerificationException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}

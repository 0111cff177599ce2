package org.aether.verification.core;

import lombok.Getter;

/**
 * 某个契约表达式或 MIR 构造目前没有求解器编码。
 * 按名称报告，绝不静默近似。
 */
@Getter
public class UnsupportedConstructException extends VerificationException {

    /**
     * 不受支持的构造名称，例如 "InSet" 或 "BitAnd"。
     */
    private final String construct;

    public UnsupportedConstructException(String construct, String message) {
        super(message);
        this.construct = construct;
    }
}

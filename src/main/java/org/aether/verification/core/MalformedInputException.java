package org.aether.verification.core;

/**
 * 输入的 CFG 结构不合法，例如缺少入口块或跳转到不存在的块。
 */
public class MalformedInputException extends VerificationException {

    public MalformedInputException(String message) {
        super(message);
    }
}

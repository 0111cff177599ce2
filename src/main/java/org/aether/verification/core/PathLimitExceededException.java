package org.aether.verification.core;

import lombok.Getter;

/**
 * VC 生成器在单个函数上探索的路径数超过了配置的上限。
 */
@Getter
public class PathLimitExceededException extends VerificationException {

    private final int limit;

    public PathLimitExceededException(String function, int limit) {
        super("函数 " + function + " 的路径数超过上限 " + limit);
        this.limit = limit;
    }
}

package org.aether.verification.mir;

import org.aether.verification.formula.Sort;

/**
 * MIR 局部变量的类型，只保留决定求解器排序所需的信息。
 */
public enum LocalType {
    INTEGER(Sort.INT),
    FLOAT(Sort.REAL),
    BOOL(Sort.BOOL),
    CHAR(Sort.INT),
    ARRAY(Sort.ARRAY),
    // 以下类型在公式中只作为不透明的整数值出现
    STRING(Sort.INT),
    REFERENCE(Sort.INT),
    UNIT(Sort.INT);

    private final Sort sort;

    LocalType(Sort sort) {
        this.sort = sort;
    }

    public Sort getSort() {
        return sort;
    }
}

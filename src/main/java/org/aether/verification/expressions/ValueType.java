package org.aether.verification.expressions;

/**
 * 契约语言中可以出现在量词约束变量和类型谓词上的值类型。
 */
public enum ValueType {
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool"),
    STRING("string"),
    ARRAY("array"),
    OBJECT("object");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

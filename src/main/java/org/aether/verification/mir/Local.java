package org.aether.verification.mir;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * MIR 局部变量。编号 0 保存返回值。
 */
@Getter
public final class Local {

    private final int id;
    // 源码中的名称，临时变量为 null
    private final String name;
    private final LocalType type;

    private Local(int id, String name, LocalType type) {
        if (id < 0) {
            throw new IllegalArgumentException("局部变量编号不能为负: " + id);
        }
        this.id = id;
        this.name = name;
        this.type = Objects.requireNonNull(type, "Local type cannot be null.");
    }

    public static Local named(int id, String name, LocalType type) {
        return new Local(id, Objects.requireNonNull(name, "Local name cannot be null."), type);
    }

    public static Local temp(int id, LocalType type) {
        return new Local(id, null, type);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    @Override
    public String toString() {
        return "_" + id + (name != null ? "(" + name + ")" : "") + ": " + type;
    }
}

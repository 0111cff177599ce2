package org.aether.verification.contract;

import lombok.Getter;

import java.util.Objects;

/**
 * 建议的验证方式。RUNTIME_ONLY 的条件不会生成静态 VC。
 */
@Getter
public final class VerificationHint {

    public enum Kind {
        SMT_SOLVER,
        SYMBOLIC_EXECUTION,
        ABSTRACT_INTERPRETATION,
        STATIC_CHECK,
        RUNTIME_ONLY,
        CUSTOM
    }

    public static final VerificationHint SMT_SOLVER = new VerificationHint(Kind.SMT_SOLVER, null);
    public static final VerificationHint SYMBOLIC_EXECUTION = new VerificationHint(Kind.SYMBOLIC_EXECUTION, null);
    public static final VerificationHint ABSTRACT_INTERPRETATION = new VerificationHint(Kind.ABSTRACT_INTERPRETATION, null);
    public static final VerificationHint STATIC_CHECK = new VerificationHint(Kind.STATIC_CHECK, null);
    public static final VerificationHint RUNTIME_ONLY = new VerificationHint(Kind.RUNTIME_ONLY, null);

    private final Kind kind;
    // 仅 CUSTOM 有名称
    private final String name;

    private VerificationHint(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static VerificationHint custom(String name) {
        return new VerificationHint(Kind.CUSTOM, Objects.requireNonNull(name, "Hint name cannot be null."));
    }

    public boolean isRuntimeOnly() {
        return kind == Kind.RUNTIME_ONLY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VerificationHint that = (VerificationHint) o;
        return kind == that.kind && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name == null ? kind.name() : kind.name() + "(" + name + ")";
    }
}

package org.aether.verification.mir;

import lombok.Getter;

import java.util.Objects;

/**
 * 操作数：读取局部变量（copy / move）或常量。
 */
@Getter
public final class Operand {

    public enum Kind {
        COPY,
        MOVE,
        CONSTANT
    }

    private final Kind kind;
    private final int local;
    // 仅 CONSTANT
    private final MirConstant constant;

    private Operand(Kind kind, int local, MirConstant constant) {
        this.kind = kind;
        this.local = local;
        this.constant = constant;
    }

    public static Operand copy(int local) {
        return new Operand(Kind.COPY, local, null);
    }

    public static Operand move(int local) {
        return new Operand(Kind.MOVE, local, null);
    }

    public static Operand constant(MirConstant constant) {
        return new Operand(Kind.CONSTANT, -1, Objects.requireNonNull(constant, "Constant cannot be null."));
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    @Override
    public String toString() {
        switch (kind) {
            case COPY:
                return "copy _" + local;
            case MOVE:
                return "move _" + local;
            default:
                return "const " + constant;
        }
    }
}

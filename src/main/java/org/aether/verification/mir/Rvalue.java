package org.aether.verification.mir;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 赋值语句的右侧。
 * 各种形式共用一个类，未用到的字段为 null 或空。
 */
@Getter
public final class Rvalue {

    public enum Kind {
        USE,
        BINARY_OP,
        UNARY_OP,
        CAST,
        CALL,
        AGGREGATE,
        REF,
        LEN,
        DISCRIMINANT
    }

    private final Kind kind;
    private final List<Operand> operands;
    private final MirBinaryOp binaryOp;
    private final MirUnaryOp unaryOp;
    // CALL 的被调函数名
    private final String function;
    // CAST 的目标类型
    private final LocalType castType;
    // REF / LEN / DISCRIMINANT 所作用的局部变量
    private final int place;

    private Rvalue(Kind kind, List<Operand> operands, MirBinaryOp binaryOp, MirUnaryOp unaryOp,
                   String function, LocalType castType, int place) {
        this.kind = kind;
        this.operands = List.copyOf(operands);
        this.binaryOp = binaryOp;
        this.unaryOp = unaryOp;
        this.function = function;
        this.castType = castType;
        this.place = place;
    }

    public static Rvalue use(Operand operand) {
        return new Rvalue(Kind.USE, List.of(operand), null, null, null, null, -1);
    }

    public static Rvalue binary(MirBinaryOp op, Operand left, Operand right) {
        return new Rvalue(Kind.BINARY_OP, List.of(left, right), Objects.requireNonNull(op), null, null, null, -1);
    }

    public static Rvalue unary(MirUnaryOp op, Operand operand) {
        return new Rvalue(Kind.UNARY_OP, List.of(operand), null, Objects.requireNonNull(op), null, null, -1);
    }

    public static Rvalue cast(Operand operand, LocalType type) {
        return new Rvalue(Kind.CAST, List.of(operand), null, null, null, Objects.requireNonNull(type), -1);
    }

    public static Rvalue call(String function, List<Operand> args) {
        return new Rvalue(Kind.CALL, args, null, null, Objects.requireNonNull(function), null, -1);
    }

    public static Rvalue aggregate(List<Operand> operands) {
        return new Rvalue(Kind.AGGREGATE, operands, null, null, null, null, -1);
    }

    public static Rvalue ref(int local) {
        return new Rvalue(Kind.REF, List.of(), null, null, null, null, local);
    }

    public static Rvalue len(int local) {
        return new Rvalue(Kind.LEN, List.of(), null, null, null, null, local);
    }

    public static Rvalue discriminant(int local) {
        return new Rvalue(Kind.DISCRIMINANT, List.of(), null, null, null, null, local);
    }

    public Operand getOperand(int index) {
        return operands.get(index);
    }

    @Override
    public String toString() {
        switch (kind) {
            case USE:
                return operands.get(0).toString();
            case BINARY_OP:
                return binaryOp + "(" + operands.get(0) + ", " + operands.get(1) + ")";
            case UNARY_OP:
                return unaryOp + "(" + operands.get(0) + ")";
            case CAST:
                return operands.get(0) + " as " + castType;
            case CALL:
                return function + operands.stream().map(Operand::toString).collect(Collectors.joining(", ", "(", ")"));
            case AGGREGATE:
                return operands.stream().map(Operand::toString).collect(Collectors.joining(", ", "[", "]"));
            default:
                return kind.name().toLowerCase() + "(_" + place + ")";
        }
    }
}

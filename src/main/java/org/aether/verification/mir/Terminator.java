package org.aether.verification.mir;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 基本块的终结指令。
 */
@Getter
public final class Terminator {

    public enum Kind {
        RETURN,
        GOTO,
        SWITCH_INT,
        CALL,
        DROP,
        ASSERT,
        UNREACHABLE
    }

    public static final Terminator RETURN = new Terminator(Kind.RETURN, null, List.of(), List.of(), List.of(), -1,
            null, -1, null, true, null, SourceLocation.UNKNOWN);
    public static final Terminator UNREACHABLE = new Terminator(Kind.UNREACHABLE, null, List.of(), List.of(), List.of(), -1,
            null, -1, null, true, null, SourceLocation.UNKNOWN);

    private final Kind kind;
    // SWITCH_INT 的判别式，或 ASSERT 的条件
    private final Operand operand;
    // SWITCH_INT 的取值与对应目标
    private final List<Long> values;
    private final List<Integer> targets;
    // CALL 的实参
    private final List<Operand> arguments;
    // SWITCH_INT 的 otherwise，或 GOTO / DROP / ASSERT 的目标
    private final int target;
    // CALL 的被调函数名
    private final String function;
    // CALL 的目标局部变量或 DROP 的局部变量，-1 表示没有
    private final int local;
    // CALL 的返回块，发散调用为 null
    private final Integer returnTarget;
    private final boolean expected;
    private final String message;
    private final SourceLocation location;

    private Terminator(Kind kind, Operand operand, List<Long> values, List<Integer> targets, List<Operand> arguments,
                       int target, String function, int local, Integer returnTarget, boolean expected, String message,
                       SourceLocation location) {
        this.kind = kind;
        this.operand = operand;
        this.values = List.copyOf(values);
        this.targets = List.copyOf(targets);
        this.arguments = List.copyOf(arguments);
        this.target = target;
        this.function = function;
        this.local = local;
        this.returnTarget = returnTarget;
        this.expected = expected;
        this.message = message;
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
    }

    public static Terminator gotoBlock(int target) {
        return new Terminator(Kind.GOTO, null, List.of(), List.of(), List.of(), target, null, -1, null, true, null,
                SourceLocation.UNKNOWN);
    }

    public static Terminator switchInt(Operand discriminant, List<Long> values, List<Integer> targets, int otherwise) {
        Objects.requireNonNull(discriminant, "Discriminant cannot be null.");
        if (values.size() != targets.size()) {
            throw new IllegalArgumentException("switchInt 的取值与目标数量不一致: " + values + " / " + targets);
        }
        return new Terminator(Kind.SWITCH_INT, discriminant, values, targets, List.of(), otherwise, null, -1, null,
                true, null, SourceLocation.UNKNOWN);
    }

    /**
     * 二路布尔分支：判别式为真时跳到 thenTarget，否则跳到 elseTarget。
     */
    public static Terminator branch(Operand condition, int thenTarget, int elseTarget) {
        return switchInt(condition, List.of(1L), List.of(thenTarget), elseTarget);
    }

    public static Terminator call(String function, List<Operand> arguments, int destination, Integer returnTarget) {
        return new Terminator(Kind.CALL, null, List.of(), List.of(), arguments, -1,
                Objects.requireNonNull(function, "Function cannot be null."), destination, returnTarget, true, null,
                SourceLocation.UNKNOWN);
    }

    public static Terminator drop(int local, int target) {
        return new Terminator(Kind.DROP, null, List.of(), List.of(), List.of(), target, null, local, null, true, null,
                SourceLocation.UNKNOWN);
    }

    public static Terminator assertion(Operand condition, boolean expected, String message, int target) {
        return assertion(condition, expected, message, target, SourceLocation.UNKNOWN);
    }

    public static Terminator assertion(Operand condition, boolean expected, String message, int target,
                                       SourceLocation location) {
        return new Terminator(Kind.ASSERT, Objects.requireNonNull(condition, "Condition cannot be null."), List.of(),
                List.of(), List.of(), target, null, -1, null, expected, message, location);
    }

    public Optional<Integer> getReturnTarget() {
        return Optional.ofNullable(returnTarget);
    }

    /**
     * @return 所有后继块，按跳转顺序。
     */
    public List<Integer> successors() {
        switch (kind) {
            case GOTO:
            case DROP:
            case ASSERT:
                return List.of(target);
            case SWITCH_INT: {
                List<Integer> result = new ArrayList<>(targets);
                result.add(target);
                return result;
            }
            case CALL:
                return returnTarget == null ? List.of() : List.of(returnTarget);
            default:
                return List.of();
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case GOTO:
                return "goto bb" + target;
            case SWITCH_INT:
                return "switchInt(" + operand + ") " + values + " -> " + targets + ", otherwise bb" + target;
            case CALL:
                return "_" + local + " = " + function
                        + arguments.stream().map(Operand::toString).collect(Collectors.joining(", ", "(", ")"))
                        + (returnTarget != null ? " -> bb" + returnTarget : "");
            case DROP:
                return "drop(_" + local + ") -> bb" + target;
            case ASSERT:
                return "assert(" + operand + " == " + expected + ") -> bb" + target;
            default:
                return kind.name().toLowerCase();
        }
    }
}

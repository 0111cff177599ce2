package org.aether.verification.mir;

import java.util.List;

/**
 * 测试共用的小型 MIR 函数。
 */
public final class MirFixtures {

    private MirFixtures() {
    }

    /**
     * fn id(x: int) -> int { x }
     */
    public static MirFunction identity(String name) {
        return MirFunction.builder(name)
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "x", LocalType.INTEGER))
                .block(0, List.of(Statement.assign(0, Rvalue.use(Operand.copy(1)))), Terminator.RETURN)
                .build();
    }

    /**
     * fn div(a: int, b: int) -> int { a / b }
     */
    public static MirFunction division() {
        return MirFunction.builder("div")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "a", LocalType.INTEGER))
                .parameter(Local.named(2, "b", LocalType.INTEGER))
                .block(0, List.of(Statement.assign(0,
                        Rvalue.binary(MirBinaryOp.DIV, Operand.copy(1), Operand.copy(2)))), Terminator.RETURN)
                .build();
    }

    /**
     * fn max(a: int, b: int) -> int { if a > b { a } else { b } }
     */
    public static MirFunction max() {
        return MirFunction.builder("max")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "a", LocalType.INTEGER))
                .parameter(Local.named(2, "b", LocalType.INTEGER))
                .local(Local.temp(3, LocalType.BOOL))
                .block(0, List.of(Statement.assign(3,
                                Rvalue.binary(MirBinaryOp.GT, Operand.copy(1), Operand.copy(2)))),
                        Terminator.branch(Operand.copy(3), 1, 2))
                .block(1, List.of(Statement.assign(0, Rvalue.use(Operand.copy(1)))), Terminator.gotoBlock(3))
                .block(2, List.of(Statement.assign(0, Rvalue.use(Operand.copy(2)))), Terminator.gotoBlock(3))
                .block(3, Terminator.RETURN)
                .build();
    }

    /**
     * fn count(n: int) -> int { let mut i = 0; while i < n { i = i + 1; } i }
     * 循环头为 bb1。
     */
    public static MirFunction countUp() {
        return MirFunction.builder("count")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "n", LocalType.INTEGER))
                .local(Local.named(2, "i", LocalType.INTEGER))
                .local(Local.temp(3, LocalType.BOOL))
                .block(0, List.of(Statement.assign(2, Rvalue.use(Operand.constant(MirConstant.ofInt(0))))),
                        Terminator.gotoBlock(1))
                .block(1, List.of(Statement.assign(3,
                                Rvalue.binary(MirBinaryOp.LT, Operand.copy(2), Operand.copy(1)))),
                        Terminator.branch(Operand.copy(3), 2, 3))
                .block(2, List.of(Statement.assign(2,
                                Rvalue.binary(MirBinaryOp.ADD, Operand.copy(2), Operand.constant(MirConstant.ofInt(1))))),
                        Terminator.gotoBlock(1))
                .block(3, List.of(Statement.assign(0, Rvalue.use(Operand.copy(2)))), Terminator.RETURN)
                .build();
    }

    /**
     * 两个串联的菱形分支，共四条路径。
     */
    public static MirFunction twoDiamonds() {
        return MirFunction.builder("diamonds")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "p", LocalType.BOOL))
                .block(0, Terminator.branch(Operand.copy(1), 1, 2))
                .block(1, Terminator.gotoBlock(3))
                .block(2, Terminator.gotoBlock(3))
                .block(3, Terminator.branch(Operand.copy(1), 4, 5))
                .block(4, Terminator.gotoBlock(6))
                .block(5, Terminator.gotoBlock(6))
                .block(6, Terminator.RETURN)
                .build();
    }

    /**
     * fn check(x: int) -> int { assert!(x > 0); x }
     */
    public static MirFunction asserting() {
        return MirFunction.builder("check")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "x", LocalType.INTEGER))
                .local(Local.temp(2, LocalType.BOOL))
                .block(0, List.of(Statement.assign(2,
                                Rvalue.binary(MirBinaryOp.GT, Operand.copy(1), Operand.constant(MirConstant.ofInt(0))))),
                        Terminator.assertion(Operand.copy(2), true, "x must be positive", 1))
                .block(1, List.of(Statement.assign(0, Rvalue.use(Operand.copy(1)))), Terminator.RETURN)
                .build();
    }

    /**
     * fn down(n: int) -> int { down(n - 1) }
     */
    public static MirFunction recursive() {
        return MirFunction.builder("down")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "n", LocalType.INTEGER))
                .local(Local.temp(2, LocalType.INTEGER))
                .local(Local.temp(3, LocalType.INTEGER))
                .block(0, List.of(Statement.assign(2,
                                Rvalue.binary(MirBinaryOp.SUB, Operand.copy(1), Operand.constant(MirConstant.ofInt(1))))),
                        Terminator.call("down", List.of(Operand.copy(2)), 3, 1))
                .block(1, List.of(Statement.assign(0, Rvalue.use(Operand.copy(3)))), Terminator.RETURN)
                .build();
    }

    /**
     * fn one(x: int) -> int { match x { 1 => 1, _ => 0 } }
     */
    public static MirFunction matchOne() {
        return MirFunction.builder("one")
                .returnLocal(LocalType.INTEGER)
                .parameter(Local.named(1, "x", LocalType.INTEGER))
                .block(0, Terminator.switchInt(Operand.copy(1), List.of(1L), List.of(1), 2))
                .block(1, List.of(Statement.assign(0, Rvalue.use(Operand.constant(MirConstant.ofInt(1))))),
                        Terminator.RETURN)
                .block(2, List.of(Statement.assign(0, Rvalue.use(Operand.constant(MirConstant.ofInt(0))))),
                        Terminator.RETURN)
                .build();
    }
}

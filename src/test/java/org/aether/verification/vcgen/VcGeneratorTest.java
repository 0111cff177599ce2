package org.aether.verification.vcgen;

import org.aether.verification.contract.*;
import org.aether.verification.core.MalformedInputException;
import org.aether.verification.core.PathLimitExceededException;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.core.UnsupportedConstructException;
import org.aether.verification.expressions.*;
import org.aether.verification.mir.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class VcGeneratorTest {

    private static final SourceLocation LOC = SourceLocation.of("test.ae", 1, 1);
    private static final Constant ZERO = Constant.ofInteger(0);

    private static ContractExpression bin(BinaryOperator op, ContractExpression l, ContractExpression r) {
        return BinaryOperation.of(op, l, r);
    }

    private static ContractExpression var(String name) {
        return Variable.of(name);
    }

    private static List<VcKind> kinds(List<VerificationCondition> vcs) {
        return vcs.stream().map(VerificationCondition::getKind).collect(Collectors.toList());
    }

    private static List<String> names(List<VerificationCondition> vcs) {
        return vcs.stream().map(VerificationCondition::getName).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("直线代码 (Straight-line Code)")
    class StraightLineTests {

        @Test
        @DisplayName("没有契约也没有除法时不生成 VC")
        void testNoContract_NoVcs() throws Exception {
            assertTrue(new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), null).isEmpty());
        }

        @Test
        @DisplayName("后置条件 VC 以前置条件为前件，result 代入返回值")
        void testPostcondition_UsesPreconditionAndResult() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addPrecondition("positive", bin(BinaryOperator.GT, var("x"), ZERO), LOC)
                    .addPostcondition("nonneg", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), contract);
            assertAll(
                    () -> assertEquals(1, vcs.size()),
                    () -> assertEquals("postcondition_nonneg#1", vcs.get(0).getName()),
                    () -> assertEquals(VcKind.POSTCONDITION, vcs.get(0).getKind()),
                    () -> assertEquals("((x > 0) => (x >= 0))", vcs.get(0).getFormula().toString()),
                    () -> assertEquals(LOC, vcs.get(0).getLocation()),
                    () -> assertEquals(List.of(0), vcs.get(0).getTrace())
            );
        }

        @Test
        @DisplayName("除法生成且仅生成一个除零 VC")
        void testDivision_ExactlyOneVc() throws Exception {
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.division(), null);
            assertAll(
                    () -> assertEquals(1, vcs.size()),
                    () -> assertEquals("div_by_zero_div#1", vcs.get(0).getName()),
                    () -> assertEquals(VcKind.DIVISION_BY_ZERO, vcs.get(0).getKind()),
                    () -> assertEquals("(b != 0)", vcs.get(0).getFormula().toString())
            );
        }

        @Test
        @DisplayName("old(x) 指向入口值")
        void testOld_RefersToEntryValue() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("same", bin(BinaryOperator.EQ, ResultValue.INSTANCE, Old.of(var("x"))), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), contract);
            assertEquals("(x = x)", vcs.get(0).getFormula().toString());
        }

        @Test
        @DisplayName("仅运行时检查的后置条件不生成 VC")
        void testRuntimeOnlyPostcondition_Skipped() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addEnhancedPostcondition("runtime", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC,
                            null, FailureAction.LOG_AND_CONTINUE, VerificationHint.RUNTIME_ONLY);
            assertTrue(new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), contract).isEmpty());
        }

        @Test
        @DisplayName("静态检查的前置条件生成可满足性 VC")
        void testStaticCheckPrecondition_EmitsSatisfiabilityVc() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addEnhancedPrecondition("sat", bin(BinaryOperator.GT, var("x"), ZERO), LOC,
                            null, FailureAction.ABORT, VerificationHint.STATIC_CHECK);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), contract);
            assertAll(
                    () -> assertEquals(List.of(VcKind.PRECONDITION), kinds(vcs)),
                    () -> assertEquals("precondition_sat#1", vcs.get(0).getName()),
                    () -> assertEquals("(exists x:Int. (x > 0))", vcs.get(0).getFormula().toString())
            );
        }

        @Test
        @DisplayName("函数不变量与全局不变量在返回处检查")
        void testInvariants_CheckedAtReturn() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addInvariant("local_inv", bin(BinaryOperator.GE, var("x"), ZERO), LOC, null);
            GlobalInvariant global = new GlobalInvariant("global_inv", bin(BinaryOperator.LT, var("x"), Constant.ofInteger(10)),
                    InvariantScope.ALWAYS, LOC);
            GlobalInvariant elsewhere = new GlobalInvariant("other", bin(BinaryOperator.LT, var("x"), ZERO),
                    InvariantScope.function("other_fn"), LOC);
            VcGenerator generator = new VcGenerator(List.of(), List.of(global, elsewhere), VcGenerator.DEFAULT_MAX_PATHS);
            List<VerificationCondition> vcs = generator.generateFunctionVcs(MirFixtures.identity("id"), contract);
            assertAll(
                    () -> assertEquals(List.of("invariant_local_inv#1", "invariant_global_inv#2"), names(vcs)),
                    () -> assertEquals("(((x >= 0) && (x < 10)) => (x >= 0))", vcs.get(0).getFormula().toString())
            );
        }

        @Test
        @DisplayName("契约中不受支持的构造按名称报告")
        void testUnsupportedConstruct_Propagates() {
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("member", InSet.of(ResultValue.INSTANCE, var("s")), LOC);
            UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                    () -> new VcGenerator().generateFunctionVcs(MirFixtures.identity("id"), contract));
            assertEquals("InSet", e.getConstruct());
        }
    }

    @Nested
    @DisplayName("分支 (Branching)")
    class BranchTests {

        @Test
        @DisplayName("两条路径分别携带分支谓词及其否定")
        void testBranch_PathConditions() throws Exception {
            FunctionContract contract = new FunctionContract("max")
                    .addPostcondition("ge_a", bin(BinaryOperator.GE, ResultValue.INSTANCE, var("a")), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.max(), contract);
            assertAll(
                    () -> assertEquals(List.of("postcondition_ge_a#1", "postcondition_ge_a#2"), names(vcs)),
                    () -> assertEquals("((a > b) => (a >= a))", vcs.get(0).getFormula().toString()),
                    () -> assertEquals("((a <= b) => (b >= a))", vcs.get(1).getFormula().toString()),
                    () -> assertEquals(List.of(0, 1, 3), vcs.get(0).getTrace()),
                    () -> assertEquals(List.of(0, 2, 3), vcs.get(1).getTrace())
            );
        }

        @Test
        @DisplayName("超过路径上限时抛出 PathLimitExceededException")
        void testPathLimit_Exceeded() {
            VcGenerator generator = new VcGenerator(List.of(), List.of(), 2);
            assertThrows(PathLimitExceededException.class,
                    () -> generator.generateFunctionVcs(MirFixtures.twoDiamonds(), null));
        }

        @Test
        @DisplayName("路径上限足够时探索全部路径")
        void testPathLimit_Sufficient() throws Exception {
            FunctionContract contract = new FunctionContract("diamonds")
                    .addPostcondition("any", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC);
            VcGenerator generator = new VcGenerator(List.of(), List.of(), 4);
            assertEquals(4, generator.generateFunctionVcs(MirFixtures.twoDiamonds(), contract).size());
        }

        @Test
        @DisplayName("多路 switch 的每个后继都被探索")
        void testMultiWaySwitch_FollowsAllSuccessors() throws Exception {
            MirFunction function = MirFunction.builder("pick")
                    .returnLocal(LocalType.INTEGER)
                    .parameter(Local.named(1, "k", LocalType.INTEGER))
                    .block(0, Terminator.switchInt(Operand.copy(1), List.of(0L, 1L, 2L), List.of(1, 2, 3), 4))
                    .block(1, Terminator.RETURN)
                    .block(2, Terminator.RETURN)
                    .block(3, Terminator.RETURN)
                    .block(4, Terminator.RETURN)
                    .build();
            FunctionContract contract = new FunctionContract("pick")
                    .addPostcondition("any", bin(BinaryOperator.GE, var("k"), ZERO), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(function, contract);
            assertAll(
                    () -> assertEquals(4, vcs.size()),
                    () -> assertEquals("(k >= 0)", vcs.get(0).getFormula().toString())
            );
        }

        @Test
        @DisplayName("整数判别式按取值相等分支，otherwise 路径保留其余取值")
        void testIntegerSwitch_ComparesAgainstValue() throws Exception {
            FunctionContract contract = new FunctionContract("one")
                    .addPostcondition("post", bin(BinaryOperator.OR,
                            bin(BinaryOperator.EQ, ResultValue.INSTANCE, Constant.ofInteger(1)),
                            bin(BinaryOperator.EQ, var("x"), ZERO)), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.matchOne(), contract);
            assertAll(
                    () -> assertEquals(2, vcs.size()),
                    () -> assertEquals("((x = 1) => ((1 = 1) || (x = 0)))", vcs.get(0).getFormula().toString()),
                    () -> assertEquals("((x != 1) => ((0 = 1) || (x = 0)))", vcs.get(1).getFormula().toString()),
                    () -> assertEquals(List.of(0, 1), vcs.get(0).getTrace()),
                    () -> assertEquals(List.of(0, 2), vcs.get(1).getTrace())
            );
        }
    }

    @Nested
    @DisplayName("断言与调用 (Assertions and Calls)")
    class AssertAndCallTests {

        @Test
        @DisplayName("断言生成 VC，之后的路径假设断言成立")
        void testAssert_EmitsAndAssumes() throws Exception {
            FunctionContract contract = new FunctionContract("check")
                    .addPostcondition("positive", bin(BinaryOperator.GT, ResultValue.INSTANCE, ZERO), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.asserting(), contract);
            assertAll(
                    () -> assertEquals(List.of(VcKind.ASSERTION, VcKind.POSTCONDITION), kinds(vcs)),
                    () -> assertEquals("assertion_check#1", vcs.get(0).getName()),
                    () -> assertEquals("(x > 0)", vcs.get(0).getFormula().toString()),
                    () -> assertEquals("((x > 0) => (x > 0))", vcs.get(1).getFormula().toString())
            );
        }

        @Test
        @DisplayName("带 decreases 的递归调用生成终止 VC，调用结果是不透明值")
        void testRecursiveCall_TerminationVc() throws Exception {
            FunctionContract contract = new FunctionContract("down")
                    .setDecreases(var("n"))
                    .addPostcondition("nonneg", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.recursive(), contract);
            assertAll(
                    () -> assertEquals(List.of(VcKind.TERMINATION, VcKind.POSTCONDITION), kinds(vcs)),
                    () -> assertEquals("termination_down#1", vcs.get(0).getName()),
                    () -> assertEquals("((0 <= (n - 1)) && ((n - 1) < n))", vcs.get(0).getFormula().toString()),
                    () -> assertEquals("(call_result_1 >= 0)", vcs.get(1).getFormula().toString())
            );
        }
    }

    @Nested
    @DisplayName("循环 (Loops)")
    class LoopTests {

        private FunctionContract nonNegative() {
            return new FunctionContract("count")
                    .addPrecondition("n_nonneg", bin(BinaryOperator.GE, var("n"), ZERO), LOC);
        }

        @Test
        @DisplayName("带不变量和变式的循环生成进入、保持与终止 VC")
        void testLoop_EntryPreservationTermination() throws Exception {
            LoopInvariant invariant = new LoopInvariant(1)
                    .addCondition("i_le_n", bin(BinaryOperator.LE, var("i"), var("n")), LOC)
                    .setVariant(bin(BinaryOperator.SUB, var("n"), var("i")), ZERO);
            VcGenerator generator = new VcGenerator(List.of(invariant), List.of(), VcGenerator.DEFAULT_MAX_PATHS);
            List<VerificationCondition> vcs = generator.generateFunctionVcs(MirFixtures.countUp(), nonNegative());
            assertAll(
                    () -> assertEquals(List.of(VcKind.LOOP_INVARIANT_ENTRY, VcKind.LOOP_INVARIANT_PRESERVATION,
                            VcKind.TERMINATION), kinds(vcs)),
                    () -> assertEquals(List.of("loop_invariant_entry_i_le_n#1", "loop_invariant_preservation_i_le_n#2",
                            "termination_loop_bb1#3"), names(vcs)),
                    () -> assertEquals("((n >= 0) => (0 <= n))", vcs.get(0).getFormula().toString()),
                    () -> assertEquals("(((n >= 0) && (i_loop1_1 <= n) && (i_loop1_1 < n)) => ((i_loop1_1 + 1) <= n))",
                            vcs.get(1).getFormula().toString()),
                    () -> assertEquals("(((n >= 0) && (i_loop1_1 <= n) && (i_loop1_1 < n)) => "
                                    + "(((n - (i_loop1_1 + 1)) < (n - i_loop1_1)) && ((n - (i_loop1_1 + 1)) >= 0)))",
                            vcs.get(2).getFormula().toString())
            );
        }

        @Test
        @DisplayName("循环后的后置条件使用 havoc 后的值和退出条件")
        void testLoop_PostconditionAfterExit() throws Exception {
            LoopInvariant invariant = new LoopInvariant(1)
                    .addCondition("i_le_n", bin(BinaryOperator.LE, var("i"), var("n")), LOC);
            FunctionContract contract = nonNegative()
                    .addPostcondition("result_is_n", bin(BinaryOperator.EQ, ResultValue.INSTANCE, var("n")), LOC);
            VcGenerator generator = new VcGenerator(List.of(invariant), List.of(), VcGenerator.DEFAULT_MAX_PATHS);
            List<VerificationCondition> vcs = generator.generateFunctionVcs(MirFixtures.countUp(), contract);
            VerificationCondition post = vcs.get(vcs.size() - 1);
            assertAll(
                    () -> assertEquals(VcKind.POSTCONDITION, post.getKind()),
                    () -> assertEquals("(((n >= 0) && (i_loop1_1 <= n) && (i_loop1_1 >= n)) => (i_loop1_1 = n))",
                            post.getFormula().toString())
            );
        }

        @Test
        @DisplayName("没有不变量的回边不会无限展开")
        void testBackEdgeWithoutInvariant_Terminates() throws Exception {
            FunctionContract contract = nonNegative()
                    .addPostcondition("nonneg", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC);
            List<VerificationCondition> vcs = new VcGenerator().generateFunctionVcs(MirFixtures.countUp(), contract);
            assertAll(
                    () -> assertEquals(1, vcs.size()),
                    () -> assertEquals("(((n >= 0) && (0 >= n)) => (0 >= 0))", vcs.get(0).getFormula().toString())
            );
        }
    }

    @Nested
    @DisplayName("非法输入 (Malformed Input)")
    class MalformedTests {

        @Test
        @DisplayName("缺少入口块")
        void testMissingEntryBlock_Throws() {
            MirFunction function = MirFunction.builder("broken")
                    .returnLocal(LocalType.INTEGER)
                    .entry(5)
                    .block(0, Terminator.RETURN)
                    .build();
            assertThrows(MalformedInputException.class, () -> new VcGenerator().generateFunctionVcs(function, null));
        }

        @Test
        @DisplayName("跳转到不存在的块")
        void testUnknownTarget_Throws() {
            MirFunction function = MirFunction.builder("broken")
                    .returnLocal(LocalType.INTEGER)
                    .block(0, Terminator.gotoBlock(9))
                    .build();
            assertThrows(MalformedInputException.class, () -> new VcGenerator().generateFunctionVcs(function, null));
        }

        @Test
        @DisplayName("路径上限必须为正")
        void testNonPositiveLimit_Throws() {
            assertThrows(IllegalArgumentException.class, () -> new VcGenerator(List.of(), List.of(), 0));
        }
    }
}

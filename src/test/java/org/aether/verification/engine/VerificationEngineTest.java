package org.aether.verification.engine;

import org.aether.verification.contract.*;
import org.aether.verification.core.SolverException;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.core.UnsupportedConstructException;
import org.aether.verification.expressions.*;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.Sort;
import org.aether.verification.mir.MirFixtures;
import org.aether.verification.mir.MirFunction;
import org.aether.verification.solver.SatResult;
import org.aether.verification.solver.StubSolver;
import org.aether.verification.symbolic.Z3Solver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class VerificationEngineTest {

    private static final SourceLocation LOC = SourceLocation.of("engine.ae", 2, 1);
    private static final Constant ZERO = Constant.ofInteger(0);

    private static ContractExpression bin(BinaryOperator op, ContractExpression l, ContractExpression r) {
        return BinaryOperation.of(op, l, r);
    }

    private static ContractExpression var(String name) {
        return Variable.of(name);
    }

    private static ContractExpression cube(ContractExpression e) {
        return bin(BinaryOperator.MUL, bin(BinaryOperator.MUL, e, e), e);
    }

    private static VerifierOptions options() {
        return new VerifierOptions().threads(2).solverTimeoutMs(10_000);
    }

    /**
     * requires x > 0; ensures result >= bound
     */
    private static FunctionContract positiveIdentity(String name, long bound) {
        return new FunctionContract(name)
                .addPrecondition("x_positive", bin(BinaryOperator.GT, var("x"), ZERO), LOC)
                .addPostcondition("result_bound", bin(BinaryOperator.GE, ResultValue.INSTANCE, Constant.ofInteger(bound)), LOC);
    }

    @Nested
    @DisplayName("Z3 后端 (Z3 Backend)")
    class Z3Tests {

        private final VerificationEngine engine = new VerificationEngine(Z3Solver::new, options());

        @Test
        @DisplayName("场景 1: 前置条件蕴含后置条件，证明成功并附证明概要")
        void testProvedPostcondition() throws Exception {
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), positiveIdentity("id", 0));
            ConditionResult condition = result.getConditions().get(0);
            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertEquals(ConditionStatus.PROVED, condition.getStatus()),
                    () -> assertEquals(SatResult.UNSAT, condition.getSatResult()),
                    () -> assertEquals("((x > 0) => (x >= 0))", condition.getCondition()),
                    () -> assertEquals(VerificationMethod.CONTRADICTION,
                            condition.getProofCertificate().orElseThrow().getMethod()),
                    () -> assertTrue(result.getCounterexamples().isEmpty())
            );
        }

        @Test
        @DisplayName("场景 2: 后置条件被反驳，反例满足前置条件且违反后置条件")
        void testRefutedPostcondition() throws Exception {
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), positiveIdentity("id", 10));
            assertFalse(result.isVerified());
            assertEquals(1, result.getCounterexamples().size());
            Counterexample counterexample = result.getCounterexamples().get(0);
            BigInteger x = counterexample.valueOf("x").orElseThrow().getIntegerValue();
            assertAll(
                    () -> assertEquals(ConditionStatus.REFUTED, result.getConditions().get(0).getStatus()),
                    () -> assertTrue(result.getConditions().get(0).getProofCertificate().isEmpty()),
                    () -> assertEquals("postcondition_result_bound#1", counterexample.getConditionName()),
                    () -> assertTrue(x.compareTo(BigInteger.ONE) >= 0 && x.compareTo(BigInteger.valueOf(9)) <= 0,
                            "x = " + x),
                    () -> assertEquals(List.of(0), counterexample.getTrace())
            );
        }

        @Test
        @DisplayName("场景 3: 除零 VC 被反驳，反例中除数为 0")
        void testDivisionByZero() throws Exception {
            VerificationResult result = engine.verifyFunction("div", MirFixtures.division(), null);
            assertAll(
                    () -> assertFalse(result.isVerified()),
                    () -> assertEquals(ConditionStatus.REFUTED,
                            result.getCondition("div_by_zero_div#1").orElseThrow().getStatus()),
                    () -> assertEquals(BigInteger.ZERO,
                            result.getCounterexamples().get(0).valueOf("b").orElseThrow().getIntegerValue())
            );
        }

        @Test
        @DisplayName("除数受前置条件约束时除零 VC 成立")
        void testDivisionGuardedByPrecondition() throws Exception {
            FunctionContract contract = new FunctionContract("div")
                    .addPrecondition("b_nonzero", bin(BinaryOperator.NE, var("b"), ZERO), LOC);
            assertTrue(engine.verifyFunction("div", MirFixtures.division(), contract).isVerified());
        }

        @Test
        @DisplayName("场景 4: if/else 两条路径分别检查")
        void testBranches() throws Exception {
            FunctionContract contract = new FunctionContract("max")
                    .addPostcondition("ge_a", bin(BinaryOperator.GE, ResultValue.INSTANCE, var("a")), LOC)
                    .addPostcondition("ge_b", bin(BinaryOperator.GE, ResultValue.INSTANCE, var("b")), LOC);
            VerificationResult result = engine.verifyFunction("max", MirFixtures.max(), contract);
            assertAll(
                    () -> assertEquals(4, result.getConditions().size()),
                    () -> assertTrue(result.isVerified())
            );
        }

        @Test
        @DisplayName("带不变量和变式的循环整体被证明")
        void testLoopWithInvariant() throws Exception {
            engine.registerLoopInvariant("count", new LoopInvariant(1)
                    .addCondition("i_le_n", bin(BinaryOperator.LE, var("i"), var("n")), LOC)
                    .setVariant(bin(BinaryOperator.SUB, var("n"), var("i")), ZERO));
            engine.registerContract(new FunctionContract("count")
                    .addPrecondition("n_nonneg", bin(BinaryOperator.GE, var("n"), ZERO), LOC)
                    .addPostcondition("result_is_n", bin(BinaryOperator.EQ, ResultValue.INSTANCE, var("n")), LOC));
            VerificationResult result = engine.verifyFunction("count", MirFixtures.countUp());
            assertAll(
                    () -> assertEquals(4, result.getConditions().size()),
                    () -> assertTrue(result.isVerified(), result::toString)
            );
        }

        @Test
        @DisplayName("背景公理参与每次检查")
        void testBackgroundAxiom() throws Exception {
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("nonneg", bin(BinaryOperator.GE, ResultValue.INSTANCE, ZERO), LOC);
            assertFalse(engine.verifyFunction("id", MirFixtures.identity("id"), contract).isVerified());
            engine.addBackgroundAxiom(Formula.ge(Formula.intVar("x"), Formula.intConst(0)));
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), contract);
            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertEquals(List.of("(x >= 0)"),
                            result.getConditions().get(0).getProofCertificate().orElseThrow().getAssumptionsUsed())
            );
        }

        @Test
        @DisplayName("直接检查契约派生的证明义务")
        void testVerifyContract() throws Exception {
            FunctionContract contract = new FunctionContract("f")
                    .addPrecondition("x_positive", bin(BinaryOperator.GT, var("x"), ZERO), LOC)
                    .addPostcondition("x_nonneg", bin(BinaryOperator.GE, var("x"), ZERO), LOC)
                    .setDecreases(var("x"));
            VerificationResult result = engine.verifyContract(contract);
            assertAll(
                    () -> assertEquals(List.of("f_pre_0", "f_post_0", "f_decreases"),
                            result.getConditions().stream().map(ConditionResult::getName).collect(Collectors.toList())),
                    () -> assertTrue(result.isVerified(), result::toString)
            );
        }

        @Test
        @DisplayName("不可满足的前置条件义务被反驳")
        void testVerifyContract_UnsatisfiablePrecondition() throws Exception {
            FunctionContract contract = new FunctionContract("g")
                    .addPrecondition("impossible", bin(BinaryOperator.AND,
                            bin(BinaryOperator.GT, var("x"), ZERO), bin(BinaryOperator.LT, var("x"), ZERO)), LOC);
            VerificationResult result = engine.verifyContract(contract);
            ConditionResult pre = result.getCondition("g_pre_0").orElseThrow();
            assertAll(
                    () -> assertEquals(ConditionStatus.REFUTED, pre.getStatus()),
                    () -> assertEquals(SatResult.SAT, pre.getSatResult()),
                    () -> assertFalse(result.isVerified())
            );
        }

        @Test
        @DisplayName("求解器超时的条件记为未判定，不产生反例")
        void testSolverTimeout_Undecided() throws Exception {
            VerificationEngine fast = new VerificationEngine(Z3Solver::new, options().solverTimeoutMs(1));
            ContractExpression one = Constant.ofInteger(1);
            ContractExpression sum = bin(BinaryOperator.ADD, cube(ResultValue.INSTANCE), cube(var("y")));
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("no_cube_sum", bin(BinaryOperator.OR,
                            bin(BinaryOperator.OR, bin(BinaryOperator.LT, ResultValue.INSTANCE, one),
                                    bin(BinaryOperator.LT, var("y"), one)),
                            bin(BinaryOperator.OR, bin(BinaryOperator.LT, var("z"), one),
                                    bin(BinaryOperator.NE, sum, cube(var("z"))))), LOC);
            VerificationResult result = fast.verifyFunction("id", MirFixtures.identity("id"), contract);
            ConditionResult condition = result.getConditions().get(0);
            assertAll(
                    () -> assertEquals(ConditionStatus.UNDECIDED, condition.getStatus()),
                    () -> assertTrue(condition.getSatResult() == SatResult.TIMEOUT
                            || condition.getSatResult() == SatResult.UNKNOWN, condition.getSatResult()::toString),
                    () -> assertFalse(result.isVerified()),
                    () -> assertTrue(result.getCounterexamples().isEmpty())
            );
        }

        @Test
        @DisplayName("实数变量的前置条件按 Real 量化，可满足即成立")
        void testVerifyContract_RealPrecondition() throws Exception {
            FunctionContract contract = new FunctionContract("g")
                    .addPrecondition("narrow", bin(BinaryOperator.AND,
                            bin(BinaryOperator.GT, var("x"), Constant.ofFloat(0.5)),
                            bin(BinaryOperator.LT, var("x"), Constant.ofFloat(0.7))), LOC)
                    .addPostcondition("positive", bin(BinaryOperator.GT, var("x"), Constant.ofFloat(0.0)), LOC);
            VerificationResult result = engine.verifyContract(contract, Map.of("x", Sort.REAL));
            ConditionResult pre = result.getCondition("g_pre_0").orElseThrow();
            assertAll(
                    () -> assertEquals(ConditionStatus.PROVED, pre.getStatus()),
                    () -> assertEquals(SatResult.UNSAT, pre.getSatResult()),
                    () -> assertTrue(pre.getCondition().contains("x:Real"), pre::getCondition),
                    () -> assertTrue(result.isVerified(), result::toString)
            );
        }

        @Test
        @DisplayName("布尔变量的前置条件按 Bool 量化")
        void testVerifyContract_BooleanPrecondition() throws Exception {
            FunctionContract contract = new FunctionContract("h")
                    .addPrecondition("enabled", var("flag"), LOC);
            VerificationResult result = engine.verifyContract(contract, Map.of("flag", Sort.BOOL));
            assertAll(
                    () -> assertEquals(ConditionStatus.PROVED, result.getCondition("h_pre_0").orElseThrow().getStatus()),
                    () -> assertTrue(result.isVerified(), result::toString)
            );
        }

        @Test
        @DisplayName("整数判别式的 otherwise 分支不丢失取值，错误的后置条件被反驳")
        void testIntegerSwitch_OtherwiseBranchRefuted() throws Exception {
            FunctionContract contract = new FunctionContract("one")
                    .addPostcondition("post", bin(BinaryOperator.OR,
                            bin(BinaryOperator.EQ, ResultValue.INSTANCE, Constant.ofInteger(1)),
                            bin(BinaryOperator.EQ, var("x"), ZERO)), LOC);
            VerificationResult result = engine.verifyFunction("one", MirFixtures.matchOne(), contract);
            assertAll(
                    () -> assertFalse(result.isVerified()),
                    () -> assertEquals(ConditionStatus.PROVED, result.getConditions().get(0).getStatus()),
                    () -> assertEquals(ConditionStatus.REFUTED, result.getConditions().get(1).getStatus()),
                    () -> assertEquals(1, result.getCounterexamples().size())
            );
        }
    }

    @Nested
    @DisplayName("参考后端 (Stub Backend)")
    class StubTests {

        @Test
        @DisplayName("参考后端对非字面 false 的 VC 一律视为已证明")
        void testStub_ProvesNonTrivialVcs() throws Exception {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), positiveIdentity("id", 0));
            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertEquals(ConditionStatus.PROVED, result.getConditions().get(0).getStatus())
            );
        }

        @Test
        @DisplayName("字面上为 false 的后置条件被反驳，反例为空")
        void testStub_RefutesLiteralFalse() throws Exception {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("never", Constant.ofBoolean(false), LOC);
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), contract);
            assertAll(
                    () -> assertFalse(result.isVerified()),
                    () -> assertEquals(ConditionStatus.REFUTED, result.getConditions().get(0).getStatus()),
                    () -> assertTrue(result.getCounterexamples().get(0).getAssignments().isEmpty())
            );
        }

        @Test
        @DisplayName("场景 5: 不受支持的构造使 verifyFunction 抛出异常")
        void testUnsupportedConstruct_Throws() {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            FunctionContract contract = new FunctionContract("id")
                    .addPostcondition("member", InSet.of(ResultValue.INSTANCE, var("s")), LOC);
            UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                    () -> engine.verifyFunction("id", MirFixtures.identity("id"), contract));
            assertEquals("InSet", e.getConstruct());
        }

        @Test
        @DisplayName("没有条件的函数视为已验证")
        void testNoConditions_Verified() throws Exception {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            VerificationResult result = engine.verifyFunction("id", MirFixtures.identity("id"), null);
            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertTrue(result.getConditions().isEmpty())
            );
        }

        @Test
        @DisplayName("否定式答案到状态的映射")
        void testStatusMapping() {
            assertAll(
                    () -> assertEquals(ConditionStatus.PROVED, ConditionResult.statusOf(SatResult.UNSAT)),
                    () -> assertEquals(ConditionStatus.REFUTED, ConditionResult.statusOf(SatResult.SAT)),
                    () -> assertEquals(ConditionStatus.UNDECIDED, ConditionResult.statusOf(SatResult.UNKNOWN)),
                    () -> assertEquals(ConditionStatus.UNDECIDED, ConditionResult.statusOf(SatResult.TIMEOUT))
            );
        }
    }

    @Nested
    @DisplayName("缓存 (Cache)")
    class CacheTests {

        @Test
        @DisplayName("第二次验证命中缓存，登记契约使缓存失效")
        void testCache_HitAndInvalidate() throws Exception {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            engine.registerContract(positiveIdentity("id", 0));
            VerificationResult first = engine.verifyFunction("id", MirFixtures.identity("id"));
            assertTrue(engine.isCached("id"));
            assertSame(first, engine.verifyFunction("id", MirFixtures.identity("id")));

            engine.registerContract(positiveIdentity("id", 1));
            assertFalse(engine.isCached("id"));
            assertNotSame(first, engine.verifyFunction("id", MirFixtures.identity("id")));
        }

        @Test
        @DisplayName("invalidate、clearCache 与关闭缓存")
        void testCache_Controls() throws Exception {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            engine.verifyFunction("a", MirFixtures.identity("a"), null);
            engine.verifyFunction("b", MirFixtures.identity("b"), null);
            engine.invalidate("a");
            assertAll(
                    () -> assertFalse(engine.isCached("a")),
                    () -> assertTrue(engine.isCached("b"))
            );
            engine.clearCache();
            assertFalse(engine.isCached("b"));

            VerificationEngine uncached = new VerificationEngine(StubSolver::new, options().cacheEnabled(false));
            uncached.verifyFunction("a", MirFixtures.identity("a"), null);
            assertFalse(uncached.isCached("a"));
        }

        @Test
        @DisplayName("登记表查询")
        void testRegistry() {
            VerificationEngine engine = new VerificationEngine(StubSolver::new, options());
            engine.registerContract(positiveIdentity("id", 0));
            assertAll(
                    () -> assertTrue(engine.getContract("id").isPresent()),
                    () -> assertTrue(engine.getContract("other").isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("并行验证 (Program Verification)")
    class ProgramTests {

        @Test
        @DisplayName("结果按函数名排序，单个函数的错误不影响其他函数")
        void testVerifyProgram_IsolationAndOrder() {
            VerificationEngine engine = new VerificationEngine(Z3Solver::new, options());
            engine.registerContract(positiveIdentity("ok", 0));
            engine.registerContract(new FunctionContract("bad")
                    .addPostcondition("member", InSet.of(ResultValue.INSTANCE, var("s")), LOC));
            engine.registerContract(positiveIdentity("wrong", 10));
            Map<String, MirFunction> program = new HashMap<>();
            program.put("wrong", MirFixtures.identity("wrong"));
            program.put("ok", MirFixtures.identity("ok"));
            program.put("bad", MirFixtures.identity("bad"));

            List<VerificationResult> results = engine.verifyProgram(program);
            assertAll(
                    () -> assertEquals(List.of("bad", "ok", "wrong"),
                            results.stream().map(VerificationResult::getFunction).collect(Collectors.toList())),
                    () -> assertFalse(results.get(0).isVerified()),
                    () -> assertTrue(results.get(0).getError().orElseThrow() instanceof UnsupportedConstructException),
                    () -> assertTrue(results.get(1).isVerified()),
                    () -> assertTrue(results.get(1).getError().isEmpty()),
                    () -> assertFalse(results.get(2).isVerified()),
                    () -> assertEquals(1, results.get(2).getCounterexamples().size())
            );
        }

        @Test
        @DisplayName("求解器无法创建时每个函数得到失败报告")
        void testVerifyProgram_SolverFailure() {
            VerificationEngine engine = new VerificationEngine(() -> {
                throw new SolverException("no solver");
            }, options());
            List<VerificationResult> results = engine.verifyProgram(Map.of("f", MirFixtures.identity("f")));
            assertAll(
                    () -> assertEquals(1, results.size()),
                    () -> assertTrue(results.get(0).getError().orElseThrow() instanceof SolverException)
            );
        }

        @Test
        @DisplayName("空程序得到空列表")
        void testVerifyProgram_Empty() {
            assertTrue(new VerificationEngine(StubSolver::new, options()).verifyProgram(Map.of()).isEmpty());
        }
    }
}

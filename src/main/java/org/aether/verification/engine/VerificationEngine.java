package org.aether.verification.engine;

import org.aether.verification.contract.*;
import org.aether.verification.core.SolverException;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.core.VerificationException;
import org.aether.verification.expressions.ValueType;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.Sort;
import org.aether.verification.mir.MirFunction;
import org.aether.verification.solver.SatResult;
import org.aether.verification.solver.SolverBackend;
import org.aether.verification.solver.SolverFactory;
import org.aether.verification.solver.SolverValue;
import org.aether.verification.translate.ExpressionTranslator;
import org.aether.verification.vcgen.VcGenerator;
import org.aether.verification.vcgen.VerificationCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * 验证引擎：为函数生成验证条件，逐个交给求解器判定，并汇总为验证报告。
 * <p>
 * 引擎持有契约、循环不变量、全局不变量、背景公理的登记表以及结果缓存。
 * 对每个 VC，引擎在新的断言作用域中断言背景公理与 VC 的否定：
 * UNSAT 记为已证明，SAT 记为被反驳并附反例，UNKNOWN / TIMEOUT 记为未决。
 * 单个 VC 的失败不会中止其余 VC 的检查。
 * <p>
 * {@link #verifyFunction} 是同步的；{@link #verifyProgram} 在固定大小的线程池上并行，每个工作线程持有自己的求解器。
 */
public class VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(VerificationEngine.class);

    private final SolverFactory solverFactory;
    private final VerifierOptions options;

    private final Map<String, FunctionContract> contracts = new ConcurrentHashMap<>();
    private final Map<String, List<LoopInvariant>> loopInvariants = new ConcurrentHashMap<>();
    private final List<GlobalInvariant> globalInvariants = new CopyOnWriteArrayList<>();
    private final List<Formula> backgroundAxioms = new CopyOnWriteArrayList<>();
    private final Map<String, VerificationResult> cache = new ConcurrentHashMap<>();

    public VerificationEngine(SolverFactory solverFactory) {
        this(solverFactory, VerifierOptions.load());
    }

    public VerificationEngine(SolverFactory solverFactory, VerifierOptions options) {
        this.solverFactory = Objects.requireNonNull(solverFactory, "Solver factory cannot be null.");
        this.options = Objects.requireNonNull(options, "Options cannot be null.");
    }

    // --- 登记表 ---

    public void registerContract(FunctionContract contract) {
        contracts.put(contract.getFunctionName(), contract);
        invalidate(contract.getFunctionName());
    }

    public Optional<FunctionContract> getContract(String function) {
        return Optional.ofNullable(contracts.get(function));
    }

    public void registerLoopInvariant(String function, LoopInvariant invariant) {
        loopInvariants.computeIfAbsent(function, f -> new CopyOnWriteArrayList<>()).add(invariant);
        invalidate(function);
    }

    public void addGlobalInvariant(GlobalInvariant invariant) {
        globalInvariants.add(Objects.requireNonNull(invariant, "Invariant cannot be null."));
        clearCache();
    }

    /**
     * 背景公理在每次检查时与 VC 的否定一起断言。
     */
    public void addBackgroundAxiom(Formula axiom) {
        backgroundAxioms.add(Objects.requireNonNull(axiom, "Axiom cannot be null."));
        clearCache();
    }

    // --- 缓存 ---

    public void invalidate(String function) {
        cache.remove(function);
    }

    public void clearCache() {
        cache.clear();
    }

    public boolean isCached(String function) {
        return cache.containsKey(function);
    }

    public VerifierOptions getOptions() {
        return options;
    }

    // --- 验证 ---

    /**
     * 使用已登记的契约验证函数。
     */
    public VerificationResult verifyFunction(String name, MirFunction function) throws VerificationException {
        return verifyFunction(name, function, contracts.get(name));
    }

    /**
     * 验证一个函数。
     * @param name     函数名，也是缓存键。
     * @param function 降级后的函数。
     * @param contract 契约，可为 null。
     * @return 验证报告。
     * @throws VerificationException VC 生成失败或求解器故障。
     */
    public VerificationResult verifyFunction(String name, MirFunction function, FunctionContract contract)
            throws VerificationException {
        if (options.isCacheEnabled()) {
            VerificationResult cached = cache.get(name);
            if (cached != null) {
                logger.info("函数 {} 命中验证缓存", name);
                return cached;
            }
        }
        try (SolverBackend solver = solverFactory.create()) {
            return verifyWith(solver, name, function, contract);
        }
    }

    private VerificationResult verifyWith(SolverBackend solver, String name, MirFunction function,
                                          FunctionContract contract) throws VerificationException {
        VcGenerator generator = new VcGenerator(loopInvariants.getOrDefault(name, List.of()), globalInvariants,
                options.getMaxPaths());
        List<VerificationCondition> vcs = generator.generateFunctionVcs(function, contract);
        solver.setTimeout(options.getSolverTimeoutMs());

        List<ConditionResult> conditions = new ArrayList<>(vcs.size());
        List<Counterexample> counterexamples = new ArrayList<>();
        for (VerificationCondition vc : vcs) {
            checkValidity(solver, vc.getName(), vc.getFormula(), vc.getLocation(), vc.getTrace(),
                    VerificationMethod.CONTRADICTION, conditions, counterexamples);
        }
        VerificationResult result = VerificationResult.of(name, conditions, counterexamples);
        logger.info("函数 {} 验证完成: {} 个条件, 已证明 {}, 被反驳 {}, 未决 {}", name, conditions.size(),
                result.countWithStatus(ConditionStatus.PROVED), result.countWithStatus(ConditionStatus.REFUTED),
                result.countWithStatus(ConditionStatus.UNDECIDED));
        if (options.isCacheEnabled()) {
            cache.put(name, result);
        }
        return result;
    }

    /**
     * 检查公式是否有效：断言其否定，UNSAT 即有效。
     */
    private void checkValidity(SolverBackend solver, String name, Formula formula, SourceLocation location,
                               List<Integer> trace, VerificationMethod method, List<ConditionResult> conditions,
                               List<Counterexample> counterexamples) throws SolverException {
        long start = System.nanoTime();
        SatResult answer;
        Map<String, SolverValue> model = null;
        solver.push();
        try {
            for (Formula axiom : backgroundAxioms) {
                solver.assertFormula(axiom);
            }
            solver.assertFormula(Formula.not(formula));
            answer = solver.checkSat();
            if (answer == SatResult.SAT) {
                model = solver.getModel();
            }
        } finally {
            solver.pop();
        }
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        ConditionStatus status = ConditionResult.statusOf(answer);
        ProofCertificate certificate = null;
        if (status == ConditionStatus.PROVED && options.isProofCertificates()) {
            certificate = certificate(name, formula, method);
        }
        conditions.add(new ConditionResult(name, formula.toString(), status, answer, location, elapsed, certificate));
        if (model != null) {
            Counterexample counterexample = new Counterexample(name, model, trace);
            counterexamples.add(counterexample);
            logger.info("{}", counterexample);
        }
        logger.debug("{}: {} ({} ms)", name, status, elapsed);
    }

    private ProofCertificate certificate(String name, Formula formula, VerificationMethod method) {
        List<String> assumptions = new ArrayList<>();
        for (Formula axiom : backgroundAxioms) {
            assumptions.add(axiom.toString());
        }
        List<String> steps = List.of("assert !" + formula, "check-sat: unsat");
        return new ProofCertificate(name, steps, assumptions, method);
    }

    /**
     * 并行验证多个函数。每个工作线程持有自己的求解器；
     * 一个函数的生成或求解错误只影响它自己的报告。
     * @return 按函数名排序的报告。
     */
    public List<VerificationResult> verifyProgram(Map<String, MirFunction> functions) {
        if (functions.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(options.getThreads(), functions.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        ThreadLocal<SolverBackend> workerSolver = new ThreadLocal<>();
        Queue<SolverBackend> created = new ConcurrentLinkedQueue<>();
        Map<String, Future<VerificationResult>> futures = new TreeMap<>();
        try {
            for (Map.Entry<String, MirFunction> entry : functions.entrySet()) {
                String name = entry.getKey();
                MirFunction function = entry.getValue();
                futures.put(name, pool.submit(() -> verifyOnWorker(name, function, workerSolver, created)));
            }
            List<VerificationResult> results = new ArrayList<>(futures.size());
            for (Map.Entry<String, Future<VerificationResult>> entry : futures.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue()));
            }
            return results;
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                    logger.warn("验证线程池未能在 1 分钟内结束");
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
            for (SolverBackend solver : created) {
                solver.close();
            }
        }
    }

    private VerificationResult verifyOnWorker(String name, MirFunction function, ThreadLocal<SolverBackend> workerSolver,
                                              Queue<SolverBackend> created) {
        if (options.isCacheEnabled()) {
            VerificationResult cached = cache.get(name);
            if (cached != null) {
                logger.info("函数 {} 命中验证缓存", name);
                return cached;
            }
        }
        try {
            SolverBackend solver = workerSolver.get();
            if (solver == null) {
                solver = solverFactory.create();
                workerSolver.set(solver);
                created.add(solver);
            }
            return verifyWith(solver, name, function, contracts.get(name));
        } catch (VerificationException | RuntimeException e) {
            logger.error("函数 {} 验证失败: {}", name, e.getMessage());
            // 求解器可能处于不一致的作用域，丢弃它
            SolverBackend broken = workerSolver.get();
            if (broken != null) {
                workerSolver.remove();
                created.remove(broken);
                broken.close();
            }
            return VerificationResult.failed(name, e);
        }
    }

    private static VerificationResult await(String name, Future<VerificationResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return VerificationResult.failed(name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return VerificationResult.failed(name, cause instanceof Exception ? (Exception) cause : e);
        }
    }

    /**
     * 不依赖函数体，直接检查契约派生的证明义务，所有自由变量按整数处理。
     * @see #verifyContract(FunctionContract, Map)
     */
    public VerificationResult verifyContract(FunctionContract contract) throws VerificationException {
        return verifyContract(contract, Collections.emptyMap());
    }

    /**
     * 不依赖函数体，直接检查契约派生的证明义务。
     * 每个义务都检查其否定是否不可满足；前置条件义务是对自由变量的存在量化，因此成立即表示前置条件可满足。
     * @param sorts 自由变量名到排序的映射，未列出的变量按 Int 处理。
     * @return 以契约函数名为名的报告。
     * @throws VerificationException 义务中含有无法翻译的构造，或求解器故障。
     */
    public VerificationResult verifyContract(FunctionContract contract, Map<String, Sort> sorts)
            throws VerificationException {
        Objects.requireNonNull(contract, "Contract cannot be null.");
        Objects.requireNonNull(sorts, "Sort environment cannot be null.");
        Map<String, ValueType> types = new HashMap<>();
        sorts.forEach((name, sort) -> types.put(name, valueTypeOf(sort)));
        List<ProofObligation> obligations = contract.generateProofObligations(types);
        ExpressionTranslator translator = new ExpressionTranslator(sorts);
        List<ConditionResult> conditions = new ArrayList<>(obligations.size());
        List<Counterexample> counterexamples = new ArrayList<>();
        try (SolverBackend solver = solverFactory.create()) {
            solver.setTimeout(options.getSolverTimeoutMs());
            for (ProofObligation obligation : obligations) {
                Formula formula = translator.translate(obligation.getFormula());
                checkValidity(solver, obligation.getId(), formula, SourceLocation.UNKNOWN, List.of(),
                        obligation.getMethod(), conditions, counterexamples);
            }
        }
        VerificationResult result = VerificationResult.of(contract.getFunctionName(), conditions, counterexamples);
        logger.info("契约 {} 的 {} 个证明义务检查完成: {}", contract.getFunctionName(), obligations.size(),
                result.isVerified() ? "全部成立" : "存在未成立的义务");
        return result;
    }

    private static ValueType valueTypeOf(Sort sort) {
        switch (sort) {
            case REAL:
                return ValueType.FLOAT;
            case BOOL:
                return ValueType.BOOLEAN;
            case ARRAY:
                return ValueType.ARRAY;
            default:
                return ValueType.INTEGER;
        }
    }
}

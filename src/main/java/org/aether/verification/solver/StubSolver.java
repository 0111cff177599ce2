package org.aether.verification.solver;

import org.aether.verification.core.SolverException;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.FormulaKind;
import org.aether.verification.formula.Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 用于流水线冒烟测试的参考后端，不做任何推理。
 * 只有当作用域中存在断言 not(false) 时回答 SAT（即引擎在检查字面上为 false 的 VC），
 * 其余情况一律回答 UNSAT。模型总是空的。
 */
public class StubSolver implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(StubSolver.class);

    private final Deque<List<Formula>> scopes = new ArrayDeque<>();
    private SatResult lastResult;

    public StubSolver() {
        scopes.push(new ArrayList<>());
    }

    @Override
    public void assertFormula(Formula formula) throws SolverException {
        if (formula.getSort() != Sort.BOOL) {
            throw new SolverException("只能断言布尔公式: " + formula);
        }
        scopes.peek().add(formula);
    }

    @Override
    public void push() {
        scopes.push(new ArrayList<>());
    }

    @Override
    public void pop() throws SolverException {
        if (scopes.size() <= 1) {
            throw new SolverException("没有可弹出的断言作用域");
        }
        scopes.pop();
    }

    @Override
    public SatResult checkSat() {
        lastResult = SatResult.UNSAT;
        for (List<Formula> scope : scopes) {
            for (Formula assertion : scope) {
                if (isNotFalse(assertion)) {
                    lastResult = SatResult.SAT;
                }
            }
        }
        logger.debug("StubSolver 在 {} 层作用域上回答 {}", scopes.size(), lastResult);
        return lastResult;
    }

    private static boolean isNotFalse(Formula formula) {
        return formula.getKind() == FormulaKind.NOT && formula.getOperands().get(0).isFalse();
    }

    @Override
    public Map<String, SolverValue> getModel() throws SolverException {
        if (lastResult != SatResult.SAT) {
            throw new SolverException("最近一次检查不是 SAT，没有模型");
        }
        return Collections.emptyMap();
    }

    @Override
    public void setTimeout(long millis) {
        // 不做推理，没有超时
    }

    @Override
    public void close() {
        scopes.clear();
    }

    public int getAssertionCount() {
        int count = 0;
        for (List<Formula> scope : scopes) {
            count += scope.size();
        }
        return count;
    }
}

package org.aether.verification.solver;

import org.aether.verification.core.SolverException;
import org.aether.verification.formula.Formula;

import java.util.Map;

/**
 * 增量式 SMT 判定过程的抽象。
 * 实现不要求线程安全，每个工作线程持有自己的实例。
 */
public interface SolverBackend extends AutoCloseable {

    /**
     * 在当前作用域中断言一个布尔公式。
     */
    void assertFormula(Formula formula) throws SolverException;

    /**
     * 开启新的断言作用域。
     */
    void push() throws SolverException;

    /**
     * 丢弃最近一次 push 之后的所有断言。
     * @throws SolverException 没有可弹出的作用域。
     */
    void pop() throws SolverException;

    SatResult checkSat() throws SolverException;

    /**
     * 最近一次检查结果为 SAT 时的模型。
     * @return 常量名到取值的映射。
     * @throws SolverException 最近一次检查结果不是 SAT。
     */
    Map<String, SolverValue> getModel() throws SolverException;

    /**
     * 设置单次检查的超时，超时的检查返回 {@link SatResult#TIMEOUT}。
     */
    void setTimeout(long millis) throws SolverException;

    @Override
    void close();
}

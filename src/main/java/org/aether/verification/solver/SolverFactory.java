package org.aether.verification.solver;

import org.aether.verification.core.SolverException;

/**
 * 新求解器实例的来源。每次调用返回一个独立的后端。
 */
@FunctionalInterface
public interface SolverFactory {

    SolverBackend create() throws SolverException;
}

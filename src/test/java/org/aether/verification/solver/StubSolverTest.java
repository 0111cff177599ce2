package org.aether.verification.solver;

import org.aether.verification.core.SolverException;
import org.aether.verification.formula.Formula;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StubSolverTest {

    private StubSolver solver;

    @BeforeEach
    void setUp() {
        solver = new StubSolver();
    }

    @Test
    @DisplayName("没有 not(false) 断言时回答 UNSAT")
    void testCheckSat_DefaultsToUnsat() throws SolverException {
        solver.assertFormula(Formula.not(Formula.gt(Formula.intVar("x"), Formula.intConst(0))));
        assertAll(
                () -> assertEquals(SatResult.UNSAT, solver.checkSat()),
                () -> assertThrows(SolverException.class, () -> solver.getModel())
        );
    }

    @Test
    @DisplayName("断言 not(false) 时回答 SAT，模型为空")
    void testCheckSat_NotFalseIsSat() throws SolverException {
        solver.assertFormula(Formula.not(Formula.FALSE));
        assertAll(
                () -> assertEquals(SatResult.SAT, solver.checkSat()),
                () -> assertTrue(solver.getModel().isEmpty())
        );
    }

    @Test
    @DisplayName("pop 丢弃作用域内的断言")
    void testPushPop_DiscardsAssertions() throws SolverException {
        solver.push();
        solver.assertFormula(Formula.not(Formula.FALSE));
        assertEquals(1, solver.getAssertionCount());
        solver.pop();
        assertAll(
                () -> assertEquals(0, solver.getAssertionCount()),
                () -> assertEquals(SatResult.UNSAT, solver.checkSat())
        );
    }

    @Test
    @DisplayName("基础作用域不能弹出，非布尔公式不能断言")
    void testErrors() {
        assertAll(
                () -> assertThrows(SolverException.class, () -> solver.pop()),
                () -> assertThrows(SolverException.class, () -> solver.assertFormula(Formula.intConst(1)))
        );
    }
}

package org.aether.verification.symbolic;

import com.microsoft.z3.*;
import org.aether.verification.core.SolverException;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.FormulaKind;
import org.aether.verification.formula.SortedVariable;
import org.aether.verification.solver.SatResult;
import org.aether.verification.solver.SolverBackend;
import org.aether.verification.solver.SolverValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;

/**
 * 基于 Z3 的求解器后端。
 * 每个实例独占一个 Z3 Context 与 Solver，不是线程安全的。
 * Int 与 Real 混合的算术和比较会把 Int 一侧提升为 Real。
 * @author Ayalyt
 */
public class Z3Solver implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

    private final Context ctx;
    private final Solver solver;
    private final Z3VariableManager varManager;
    // 当前处于作用域中的量词约束变量
    private final Deque<Map<String, Expr<?>>> boundScopes = new ArrayDeque<>();
    private int depth;
    private Status lastStatus;

    public Z3Solver() throws SolverException {
        try {
            this.ctx = new Context();
            this.solver = ctx.mkSolver();
        } catch (Z3Exception | UnsatisfiedLinkError e) {
            throw new SolverException("无法初始化 Z3: " + e.getMessage(), e);
        }
        this.varManager = new Z3VariableManager(ctx);
        logger.debug("Z3Solver 初始化完成");
    }

    @Override
    public void assertFormula(Formula formula) throws SolverException {
        Expr<?> encoded = encode(formula);
        if (!(encoded instanceof BoolExpr)) {
            throw new SolverException("只能断言布尔公式: " + formula);
        }
        try {
            solver.add((BoolExpr) encoded);
        } catch (Z3Exception e) {
            throw new SolverException("Z3 断言失败: " + formula, e);
        }
    }

    @Override
    public void push() throws SolverException {
        try {
            solver.push();
            depth++;
        } catch (Z3Exception e) {
            throw new SolverException("Z3 push 失败", e);
        }
    }

    @Override
    public void pop() throws SolverException {
        if (depth == 0) {
            throw new SolverException("没有可弹出的断言作用域");
        }
        try {
            solver.pop();
            depth--;
        } catch (Z3Exception e) {
            throw new SolverException("Z3 pop 失败", e);
        }
    }

    @Override
    public SatResult checkSat() throws SolverException {
        try {
            lastStatus = solver.check();
        } catch (Z3Exception e) {
            throw new SolverException("Z3 检查失败", e);
        }
        switch (lastStatus) {
            case SATISFIABLE:
                return SatResult.SAT;
            case UNSATISFIABLE:
                return SatResult.UNSAT;
            default:
                String reason = solver.getReasonUnknown();
                logger.debug("Z3 返回 UNKNOWN，原因: {}", reason);
                if (reason != null && (reason.contains("timeout") || reason.contains("canceled"))) {
                    return SatResult.TIMEOUT;
                }
                return SatResult.UNKNOWN;
        }
    }

    @Override
    public Map<String, SolverValue> getModel() throws SolverException {
        if (lastStatus != Status.SATISFIABLE) {
            throw new SolverException("最近一次检查不是 SAT，没有模型");
        }
        Map<String, SolverValue> result = new TreeMap<>();
        try {
            Model model = solver.getModel();
            for (FuncDecl<?> decl : model.getConstDecls()) {
                Expr<?> value = model.getConstInterp(decl);
                result.put(decl.getName().toString(), toSolverValue(value));
            }
        } catch (Z3Exception e) {
            throw new SolverException("无法读取 Z3 模型", e);
        }
        return result;
    }

    private static SolverValue toSolverValue(Expr<?> value) {
        if (value instanceof IntNum) {
            return SolverValue.ofInteger(((IntNum) value).getBigInteger());
        }
        if (value instanceof RatNum) {
            RatNum rat = (RatNum) value;
            BigDecimal numerator = new BigDecimal(rat.getBigIntNumerator());
            BigDecimal denominator = new BigDecimal(rat.getBigIntDenominator());
            return SolverValue.ofReal(numerator.divide(denominator, MathContext.DECIMAL64));
        }
        if (value != null && value.isTrue()) {
            return SolverValue.ofBoolean(true);
        }
        if (value != null && value.isFalse()) {
            return SolverValue.ofBoolean(false);
        }
        if (value instanceof ArrayExpr) {
            return SolverValue.ofArray(value.toString());
        }
        return SolverValue.unknown(String.valueOf(value));
    }

    @Override
    public void setTimeout(long millis) throws SolverException {
        if (millis <= 0 || millis > Integer.MAX_VALUE) {
            throw new SolverException("超时必须是正的毫秒数: " + millis);
        }
        Params params = ctx.mkParams();
        params.add("timeout", (int) millis);
        solver.setParameters(params);
        logger.debug("Z3 超时设置为 {} ms", millis);
    }

    @Override
    public void close() {
        ctx.close();
    }

    // --- 编码 ---

    /**
     * 将公式编码为 Z3 表达式。
     * @throws SolverException 编码失败，例如同名变量排序冲突。
     */
    Expr<?> encode(Formula formula) throws SolverException {
        try {
            return doEncode(formula);
        } catch (Z3Exception e) {
            throw new SolverException("Z3 编码失败: " + formula, e);
        }
    }

    private Expr<?> doEncode(Formula f) throws SolverException {
        switch (f.getKind()) {
            case BOOL_CONST:
                return ctx.mkBool(f.getBooleanValue());
            case INT_CONST:
                return ctx.mkInt(f.getIntValue());
            case REAL_CONST:
                return ctx.mkReal(f.getRealValue().toPlainString());
            case VAR:
                return lookupVar(f);
            case EQ:
            case NE: {
                Expr<?>[] pair = promotePair(doEncode(operand(f, 0)), doEncode(operand(f, 1)));
                BoolExpr eq = ctx.mkEq((Expr) pair[0], (Expr) pair[1]);
                return f.getKind() == FormulaKind.EQ ? eq : ctx.mkNot(eq);
            }
            case LT:
            case LE:
            case GT:
            case GE:
                return encodeComparison(f);
            case ADD:
            case SUB:
            case MUL:
            case DIV:
                return encodeArithmetic(f);
            case MOD: {
                Expr<?> l = doEncode(operand(f, 0));
                Expr<?> r = doEncode(operand(f, 1));
                if (!(l instanceof IntExpr) || !(r instanceof IntExpr)) {
                    throw new SolverException("mod 只支持整数操作数: " + f);
                }
                return ctx.mkMod((IntExpr) l, (IntExpr) r);
            }
            case AND:
                return ctx.mkAnd(encodeBoolOperands(f));
            case OR:
                return ctx.mkOr(encodeBoolOperands(f));
            case NOT:
                return ctx.mkNot(asBool(doEncode(operand(f, 0)), f));
            case IMPLIES:
                return ctx.mkImplies(asBool(doEncode(operand(f, 0)), f), asBool(doEncode(operand(f, 1)), f));
            case ITE: {
                BoolExpr c = asBool(doEncode(operand(f, 0)), f);
                Expr<?>[] pair = promotePair(doEncode(operand(f, 1)), doEncode(operand(f, 2)));
                return ctx.mkITE(c, (Expr) pair[0], (Expr) pair[1]);
            }
            case FORALL:
            case EXISTS:
                return encodeQuantifier(f);
            case SELECT:
                return ctx.mkSelect((ArrayExpr) doEncode(operand(f, 0)), (Expr) doEncode(operand(f, 1)));
            case STORE:
                return ctx.mkStore((ArrayExpr) doEncode(operand(f, 0)), (Expr) doEncode(operand(f, 1)),
                        (Expr) doEncode(operand(f, 2)));
            default:
                throw new SolverException("无法编码的公式: " + f);
        }
    }

    private static Formula operand(Formula f, int index) {
        return f.getOperands().get(index);
    }

    private Expr<?> lookupVar(Formula f) throws SolverException {
        for (Map<String, Expr<?>> scope : boundScopes) {
            Expr<?> bound = scope.get(f.getName());
            if (bound != null) {
                return bound;
            }
        }
        return varManager.getZ3Var(f.getName(), f.getSort());
    }

    private BoolExpr[] encodeBoolOperands(Formula f) throws SolverException {
        List<Formula> operands = f.getOperands();
        BoolExpr[] result = new BoolExpr[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            result[i] = asBool(doEncode(operands.get(i)), f);
        }
        return result;
    }

    private static BoolExpr asBool(Expr<?> expr, Formula context) throws SolverException {
        if (!(expr instanceof BoolExpr)) {
            throw new SolverException("需要布尔操作数: " + context);
        }
        return (BoolExpr) expr;
    }

    private ArithExpr asArith(Expr<?> expr, Formula context) throws SolverException {
        if (!(expr instanceof ArithExpr)) {
            throw new SolverException("需要算术操作数: " + context);
        }
        return (ArithExpr) expr;
    }

    /**
     * 两侧一个是 Int、一个是 Real 时，把 Int 一侧提升为 Real。
     */
    private Expr<?>[] promotePair(Expr<?> l, Expr<?> r) {
        if (l instanceof IntExpr && r instanceof RealExpr) {
            return new Expr<?>[]{ctx.mkInt2Real((IntExpr) l), r};
        }
        if (l instanceof RealExpr && r instanceof IntExpr) {
            return new Expr<?>[]{l, ctx.mkInt2Real((IntExpr) r)};
        }
        return new Expr<?>[]{l, r};
    }

    private Expr<?> encodeComparison(Formula f) throws SolverException {
        Expr<?>[] pair = promotePair(doEncode(operand(f, 0)), doEncode(operand(f, 1)));
        ArithExpr l = asArith(pair[0], f);
        ArithExpr r = asArith(pair[1], f);
        switch (f.getKind()) {
            case LT:
                return ctx.mkLt(l, r);
            case LE:
                return ctx.mkLe(l, r);
            case GT:
                return ctx.mkGt(l, r);
            default:
                return ctx.mkGe(l, r);
        }
    }

    private Expr<?> encodeArithmetic(Formula f) throws SolverException {
        Expr<?>[] pair = promotePair(doEncode(operand(f, 0)), doEncode(operand(f, 1)));
        ArithExpr l = asArith(pair[0], f);
        ArithExpr r = asArith(pair[1], f);
        switch (f.getKind()) {
            case ADD:
                return ctx.mkAdd(l, r);
            case SUB:
                return ctx.mkSub(l, r);
            case MUL:
                return ctx.mkMul(l, r);
            default:
                return ctx.mkDiv(l, r);
        }
    }

    private Expr<?> encodeQuantifier(Formula f) throws SolverException {
        Map<String, Expr<?>> scope = new HashMap<>();
        Expr<?>[] bound = new Expr<?>[f.getBoundVariables().size()];
        int i = 0;
        for (SortedVariable v : f.getBoundVariables()) {
            Expr<?> c = varManager.mkBoundVar(v.getName(), v.getSort());
            scope.put(v.getName(), c);
            bound[i++] = c;
        }
        boundScopes.push(scope);
        BoolExpr body;
        try {
            body = asBool(doEncode(operand(f, 0)), f);
        } finally {
            boundScopes.pop();
        }
        if (f.getKind() == FormulaKind.FORALL) {
            return ctx.mkForall(bound, body, 0, null, null, null, null);
        }
        return ctx.mkExists(bound, body, 0, null, null, null, null);
    }
}

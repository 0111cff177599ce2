package org.aether.verification.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.aether.verification.core.SolverException;
import org.aether.verification.formula.Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理公式变量名到 Z3 常量的映射。
 * 确保每个变量名在 Z3 Context 中只有一个对应的常量，且排序一致。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 每个求解器实例只被一个线程使用，HashMap 足够
    private final Map<String, Expr<?>> z3Vars = new LinkedHashMap<>();
    private final Map<String, Sort> sorts = new HashMap<>();

    /**
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
    }

    /**
     * 获取指定名称对应的 Z3 常量，尚未创建时创建并缓存。
     * @param name 变量名。
     * @param sort 变量排序。
     * @return 对应的 Z3 常量。
     * @throws SolverException 同名变量以不同排序出现。
     */
    public Expr<?> getZ3Var(String name, Sort sort) throws SolverException {
        Sort known = sorts.get(name);
        if (known != null && known != sort) {
            throw new SolverException("变量 " + name + " 的排序冲突: " + known + " 与 " + sort);
        }
        Expr<?> existing = z3Vars.get(name);
        if (existing != null) {
            return existing;
        }
        Expr<?> created = mkConst(name, sort);
        z3Vars.put(name, created);
        sorts.put(name, sort);
        logger.debug("创建 Z3 变量: {} : {}", name, sort.getSmtName());
        return created;
    }

    /**
     * 为量词约束变量创建常量，不进入缓存，允许约束变量遮蔽同名自由变量。
     */
    public Expr<?> mkBoundVar(String name, Sort sort) {
        return mkConst(name, sort);
    }

    private Expr<?> mkConst(String name, Sort sort) {
        switch (sort) {
            case INT:
                return ctx.mkIntConst(name);
            case REAL:
                return ctx.mkRealConst(name);
            case BOOL:
                return ctx.mkBoolConst(name);
            default:
                return ctx.mkArrayConst(name, ctx.getIntSort(), ctx.getIntSort());
        }
    }
}

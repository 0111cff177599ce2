package org.aether.verification.formula;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 求解器后端消费的最小逻辑/算术公式表示。
 * 支持 Int/Real/Bool 常量与变量、算术、比较、布尔连接词、量词、数组 select/store 和 ite。
 * 每个节点的排序在构造时推导并校验，构造失败抛出 IllegalArgumentException。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Formula {

    public static final Formula TRUE = new Formula(FormulaKind.BOOL_CONST, List.of(), Boolean.TRUE, null, Sort.BOOL, List.of());
    public static final Formula FALSE = new Formula(FormulaKind.BOOL_CONST, List.of(), Boolean.FALSE, null, Sort.BOOL, List.of());

    private final FormulaKind kind;
    private final List<Formula> operands;
    // 常量值：Boolean、Long 或 BigDecimal
    private final Object value;
    // 仅 VAR 节点有名称
    private final String name;
    private final Sort sort;
    // 仅量词节点有约束变量
    private final List<SortedVariable> boundVariables;

    private final int hashCode;

    private Formula(FormulaKind kind, List<Formula> operands, Object value, String name, Sort sort, List<SortedVariable> boundVariables) {
        this.kind = kind;
        this.operands = List.copyOf(operands);
        this.value = value;
        this.name = name;
        this.sort = sort;
        this.boundVariables = List.copyOf(boundVariables);
        this.hashCode = Objects.hash(kind, this.operands, value, name, sort, this.boundVariables);
    }

    // --- 常量与变量 ---

    public static Formula bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Formula intConst(long n) {
        return new Formula(FormulaKind.INT_CONST, List.of(), n, null, Sort.INT, List.of());
    }

    public static Formula real(BigDecimal r) {
        Objects.requireNonNull(r, "Real value cannot be null.");
        return new Formula(FormulaKind.REAL_CONST, List.of(), r, null, Sort.REAL, List.of());
    }

    public static Formula real(double r) {
        if (Double.isNaN(r) || Double.isInfinite(r)) {
            throw new IllegalArgumentException("实数常量必须是有限值: " + r);
        }
        return real(BigDecimal.valueOf(r));
    }

    public static Formula var(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        Objects.requireNonNull(sort, "Sort cannot be null.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("变量名不能为空");
        }
        return new Formula(FormulaKind.VAR, List.of(), null, name, sort, List.of());
    }

    public static Formula intVar(String name) {
        return var(name, Sort.INT);
    }

    // --- 比较 ---

    public static Formula compare(RelationType relation, Formula left, Formula right) {
        return build(relation.toFormulaKind(), List.of(left, right), List.of());
    }

    public static Formula eq(Formula left, Formula right) {
        return compare(RelationType.EQ, left, right);
    }

    public static Formula ne(Formula left, Formula right) {
        return compare(RelationType.NE, left, right);
    }

    public static Formula lt(Formula left, Formula right) {
        return compare(RelationType.LT, left, right);
    }

    public static Formula le(Formula left, Formula right) {
        return compare(RelationType.LE, left, right);
    }

    public static Formula gt(Formula left, Formula right) {
        return compare(RelationType.GT, left, right);
    }

    public static Formula ge(Formula left, Formula right) {
        return compare(RelationType.GE, left, right);
    }

    // --- 算术 ---

    public static Formula add(Formula left, Formula right) {
        return build(FormulaKind.ADD, List.of(left, right), List.of());
    }

    public static Formula sub(Formula left, Formula right) {
        return build(FormulaKind.SUB, List.of(left, right), List.of());
    }

    public static Formula mul(Formula left, Formula right) {
        return build(FormulaKind.MUL, List.of(left, right), List.of());
    }

    public static Formula div(Formula left, Formula right) {
        return build(FormulaKind.DIV, List.of(left, right), List.of());
    }

    public static Formula mod(Formula left, Formula right) {
        return build(FormulaKind.MOD, List.of(left, right), List.of());
    }

    // --- 布尔连接词 ---

    /**
     * n 元合取。空列表表示恒真。
     */
    public static Formula and(List<Formula> conjuncts) {
        if (conjuncts.isEmpty()) {
            return TRUE;
        }
        return build(FormulaKind.AND, conjuncts, List.of());
    }

    public static Formula and(Formula... conjuncts) {
        return and(Arrays.asList(conjuncts));
    }

    /**
     * n 元析取。空列表表示恒假。
     */
    public static Formula or(List<Formula> disjuncts) {
        if (disjuncts.isEmpty()) {
            return FALSE;
        }
        return build(FormulaKind.OR, disjuncts, List.of());
    }

    public static Formula or(Formula... disjuncts) {
        return or(Arrays.asList(disjuncts));
    }

    public static Formula not(Formula operand) {
        return build(FormulaKind.NOT, List.of(operand), List.of());
    }

    /**
     * 语义等价的否定，尽量保持公式可读：
     * 比较取反关系，双重否定消去，布尔常量直接翻转，其余包一层 NOT。
     */
    public static Formula negate(Formula formula) {
        RelationType relation = RelationType.fromFormulaKind(formula.kind);
        if (relation != null) {
            return compare(relation.negate(), formula.operands.get(0), formula.operands.get(1));
        }
        if (formula.kind == FormulaKind.NOT) {
            return formula.operands.get(0);
        }
        if (formula.kind == FormulaKind.BOOL_CONST) {
            return bool(!formula.getBooleanValue());
        }
        return not(formula);
    }

    public static Formula implies(Formula antecedent, Formula consequent) {
        return build(FormulaKind.IMPLIES, List.of(antecedent, consequent), List.of());
    }

    public static Formula ite(Formula condition, Formula thenBranch, Formula elseBranch) {
        return build(FormulaKind.ITE, List.of(condition, thenBranch, elseBranch), List.of());
    }

    // --- 量词 ---

    /**
     * 全称量词。约束变量为空时直接返回公式体。
     */
    public static Formula forall(List<SortedVariable> variables, Formula body) {
        if (variables.isEmpty()) {
            return requireSort(body, Sort.BOOL, "forall");
        }
        return build(FormulaKind.FORALL, List.of(body), variables);
    }

    /**
     * 存在量词。约束变量为空时直接返回公式体。
     */
    public static Formula exists(List<SortedVariable> variables, Formula body) {
        if (variables.isEmpty()) {
            return requireSort(body, Sort.BOOL, "exists");
        }
        return build(FormulaKind.EXISTS, List.of(body), variables);
    }

    // --- 数组 ---

    public static Formula select(Formula array, Formula index) {
        return build(FormulaKind.SELECT, List.of(array, index), List.of());
    }

    public static Formula store(Formula array, Formula index, Formula element) {
        return build(FormulaKind.STORE, List.of(array, index, element), List.of());
    }

    /**
     * 统一的构造入口：校验操作数排序并推导结果排序。
     */
    private static Formula build(FormulaKind kind, List<Formula> operands, List<SortedVariable> boundVariables) {
        for (Formula operand : operands) {
            Objects.requireNonNull(operand, "Operand of " + kind + " cannot be null.");
        }
        Sort sort = switch (kind) {
            case EQ, NE -> {
                Formula l = operands.get(0);
                Formula r = operands.get(1);
                if (l.sort != r.sort && !(l.sort.isArithmetic() && r.sort.isArithmetic())) {
                    throw new IllegalArgumentException("等式两侧排序不兼容: " + l + " : " + l.sort + ", " + r + " : " + r.sort);
                }
                yield Sort.BOOL;
            }
            case LT, LE, GT, GE -> {
                requireArithmetic(operands, kind);
                yield Sort.BOOL;
            }
            case ADD, SUB, MUL, DIV -> {
                requireArithmetic(operands, kind);
                yield Sort.join(operands.get(0).sort, operands.get(1).sort);
            }
            case MOD -> {
                requireArithmetic(operands, kind);
                yield Sort.INT;
            }
            case AND, OR, NOT, IMPLIES -> {
                for (Formula operand : operands) {
                    requireSort(operand, Sort.BOOL, kind.name());
                }
                yield Sort.BOOL;
            }
            case ITE -> {
                requireSort(operands.get(0), Sort.BOOL, "ite");
                Sort t = operands.get(1).sort;
                Sort e = operands.get(2).sort;
                if (t == e) {
                    yield t;
                }
                if (t.isArithmetic() && e.isArithmetic()) {
                    yield Sort.join(t, e);
                }
                throw new IllegalArgumentException("ite 两个分支排序不兼容: " + t + ", " + e);
            }
            case FORALL, EXISTS -> {
                requireSort(operands.get(0), Sort.BOOL, kind.name());
                yield Sort.BOOL;
            }
            case SELECT -> {
                requireSort(operands.get(0), Sort.ARRAY, "select");
                requireSort(operands.get(1), Sort.INT, "select");
                yield Sort.INT;
            }
            case STORE -> {
                requireSort(operands.get(0), Sort.ARRAY, "store");
                requireSort(operands.get(1), Sort.INT, "store");
                requireSort(operands.get(2), Sort.INT, "store");
                yield Sort.ARRAY;
            }
            default -> throw new IllegalStateException("叶子节点不能通过 build 构造: " + kind);
        };
        return new Formula(kind, operands, null, null, sort, boundVariables);
    }

    private static void requireArithmetic(List<Formula> operands, FormulaKind kind) {
        for (Formula operand : operands) {
            if (!operand.sort.isArithmetic()) {
                throw new IllegalArgumentException(kind + " 需要算术操作数，实际为 " + operand + " : " + operand.sort);
            }
        }
    }

    private static Formula requireSort(Formula operand, Sort expected, String context) {
        if (operand.sort != expected) {
            throw new IllegalArgumentException(context + " 需要 " + expected + " 操作数，实际为 " + operand + " : " + operand.sort);
        }
        return operand;
    }

    // --- 查询 ---

    public boolean isTrue() {
        return kind == FormulaKind.BOOL_CONST && Boolean.TRUE.equals(value);
    }

    public boolean isFalse() {
        return kind == FormulaKind.BOOL_CONST && Boolean.FALSE.equals(value);
    }

    public boolean getBooleanValue() {
        if (kind != FormulaKind.BOOL_CONST) {
            throw new IllegalStateException("不是布尔常量: " + this);
        }
        return (Boolean) value;
    }

    public long getIntValue() {
        if (kind != FormulaKind.INT_CONST) {
            throw new IllegalStateException("不是整数常量: " + this);
        }
        return (Long) value;
    }

    public BigDecimal getRealValue() {
        if (kind != FormulaKind.REAL_CONST) {
            throw new IllegalStateException("不是实数常量: " + this);
        }
        return (BigDecimal) value;
    }

    /**
     * 收集自由变量（不含量词约束的变量），按首次出现的顺序。
     * @return 变量名到排序的映射。
     */
    public Map<String, Sort> freeVariables() {
        Map<String, Sort> result = new LinkedHashMap<>();
        collectFreeVariables(Collections.emptySet(), result);
        return result;
    }

    private void collectFreeVariables(Set<String> bound, Map<String, Sort> result) {
        if (kind == FormulaKind.VAR) {
            if (!bound.contains(name)) {
                result.putIfAbsent(name, sort);
            }
            return;
        }
        Set<String> innerBound = bound;
        if (kind.isQuantifier()) {
            innerBound = new HashSet<>(bound);
            for (SortedVariable v : boundVariables) {
                innerBound.add(v.getName());
            }
        }
        for (Formula operand : operands) {
            operand.collectFreeVariables(innerBound, result);
        }
    }

    /**
     * 按名称同时替换自由变量。
     * 在量词下会跳过被约束的名称，并在替换值会捕获约束变量时对约束变量改名。
     * @param replacements 变量名到替换公式的映射。
     * @return 替换后的新公式。
     */
    public Formula substitute(Map<String, Formula> replacements) {
        if (replacements.isEmpty()) {
            return this;
        }
        switch (kind) {
            case VAR:
                return replacements.getOrDefault(name, this);
            case BOOL_CONST:
            case INT_CONST:
            case REAL_CONST:
                return this;
            case FORALL:
            case EXISTS:
                return substituteUnderQuantifier(replacements);
            default:
                List<Formula> newOperands = new ArrayList<>(operands.size());
                boolean changed = false;
                for (Formula operand : operands) {
                    Formula replaced = operand.substitute(replacements);
                    changed |= replaced != operand;
                    newOperands.add(replaced);
                }
                return changed ? build(kind, newOperands, boundVariables) : this;
        }
    }

    private Formula substituteUnderQuantifier(Map<String, Formula> replacements) {
        Map<String, Formula> inner = new HashMap<>(replacements);
        for (SortedVariable v : boundVariables) {
            inner.remove(v.getName());
        }
        if (inner.isEmpty()) {
            return this;
        }
        Set<String> captured = new HashSet<>();
        for (Formula replacement : inner.values()) {
            captured.addAll(replacement.freeVariables().keySet());
        }
        Formula body = operands.get(0);
        Set<String> avoid = new HashSet<>(captured);
        avoid.addAll(body.freeVariables().keySet());
        List<SortedVariable> newBound = new ArrayList<>(boundVariables.size());
        for (SortedVariable v : boundVariables) {
            if (captured.contains(v.getName())) {
                String fresh = v.getName();
                int suffix = 1;
                while (avoid.contains(fresh)) {
                    fresh = v.getName() + "_" + suffix++;
                }
                avoid.add(fresh);
                inner.put(v.getName(), var(fresh, v.getSort()));
                newBound.add(SortedVariable.of(fresh, v.getSort()));
            } else {
                newBound.add(v);
            }
        }
        return build(kind, List.of(body.substitute(inner)), newBound);
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return hashCode == that.hashCode
                && kind == that.kind
                && sort == that.sort
                && Objects.equals(value, that.value)
                && Objects.equals(name, that.name)
                && operands.equals(that.operands)
                && boundVariables.equals(that.boundVariables);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOOL_CONST:
            case INT_CONST:
                return value.toString();
            case REAL_CONST:
                return ((BigDecimal) value).toPlainString();
            case VAR:
                return name;
            case AND:
                return joined(" && ");
            case OR:
                return joined(" || ");
            case NOT:
                return "!" + operands.get(0);
            case IMPLIES:
                return "(" + operands.get(0) + " => " + operands.get(1) + ")";
            case ITE:
                return "(if " + operands.get(0) + " then " + operands.get(1) + " else " + operands.get(2) + ")";
            case FORALL:
            case EXISTS:
                String vars = boundVariables.stream().map(SortedVariable::toString).collect(Collectors.joining(", "));
                return "(" + kind.name().toLowerCase(Locale.ROOT) + " " + vars + ". " + operands.get(0) + ")";
            case SELECT:
                return operands.get(0) + "[" + operands.get(1) + "]";
            case STORE:
                return operands.get(0) + "[" + operands.get(1) + " := " + operands.get(2) + "]";
            default:
                return "(" + operands.get(0) + " " + operatorSymbol() + " " + operands.get(1) + ")";
        }
    }

    private String joined(String separator) {
        return operands.stream().map(Formula::toString).collect(Collectors.joining(separator, "(", ")"));
    }

    private String operatorSymbol() {
        RelationType relation = RelationType.fromFormulaKind(kind);
        if (relation != null) {
            return relation.getSymbol();
        }
        return switch (kind) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case MOD -> "%";
            default -> kind.name();
        };
    }
}

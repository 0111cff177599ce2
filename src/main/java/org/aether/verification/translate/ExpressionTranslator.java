package org.aether.verification.translate;

import org.aether.verification.core.UnsupportedConstructException;
import org.aether.verification.expressions.*;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.Sort;
import org.aether.verification.formula.SortedVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 将契约表达式翻译为求解器公式。
 * 翻译是纯函数：不修改输入，也不持有可变状态。
 * 自由变量的排序取自排序环境，未登记的名称默认为 Int。
 * 没有编码的构造按名称报告 {@link UnsupportedConstructException}。
 */
public final class ExpressionTranslator implements ContractExpressionVisitor<Formula, UnsupportedConstructException> {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    public static final String RESULT_NAME = "__result__";
    public static final String OLD_PREFIX = "old_";

    private final Map<String, Sort> sorts;

    public ExpressionTranslator() {
        this(Collections.emptyMap());
    }

    public ExpressionTranslator(Map<String, Sort> sorts) {
        this.sorts = Map.copyOf(Objects.requireNonNull(sorts, "Sort environment cannot be null."));
    }

    public static String oldName(String variable) {
        return OLD_PREFIX + variable;
    }

    /**
     * 翻译一个契约表达式。
     * @param expression 契约表达式。
     * @return 对应的公式。
     * @throws UnsupportedConstructException 表达式中含有没有求解器编码的构造，或排序不匹配。
     */
    public Formula translate(ContractExpression expression) throws UnsupportedConstructException {
        try {
            Formula result = expression.accept(this);
            logger.debug("翻译 {} => {}", expression, result);
            return result;
        } catch (IllegalArgumentException e) {
            throw new UnsupportedConstructException("SortMismatch", "排序不匹配: " + expression + " (" + e.getMessage() + ")");
        }
    }

    private Sort sortOf(String name) {
        return sorts.getOrDefault(name, Sort.INT);
    }

    private static UnsupportedConstructException unsupported(String construct, String reason) {
        return new UnsupportedConstructException(construct, construct + " 暂不支持翻译: " + reason);
    }

    private static Sort sortOf(BoundVariable variable) throws UnsupportedConstructException {
        switch (variable.getType()) {
            case INTEGER:
                return Sort.INT;
            case FLOAT:
                return Sort.REAL;
            case BOOLEAN:
                return Sort.BOOL;
            case ARRAY:
                return Sort.ARRAY;
            default:
                throw unsupported("QuantifierType", "约束变量 " + variable.getName() + " 的类型 " + variable.getType().getDisplayName() + " 没有排序");
        }
    }

    @Override
    public Formula visitVariable(Variable expr) {
        return Formula.var(expr.getName(), sortOf(expr.getName()));
    }

    @Override
    public Formula visitConstant(Constant expr) throws UnsupportedConstructException {
        switch (expr.getKind()) {
            case INTEGER:
                return Formula.intConst(expr.getIntegerValue());
            case FLOAT:
                return Formula.real(expr.getFloatValue());
            case BOOLEAN:
                return Formula.bool(expr.getBooleanValue());
            case STRING:
                throw unsupported("StringConstant", "需要字符串理论");
            default:
                throw unsupported("NullConstant", "需要引用模型");
        }
    }

    @Override
    public Formula visitBinaryOperation(BinaryOperation expr) throws UnsupportedConstructException {
        BinaryOperator op = expr.getOperator();
        if (op.getCategory() == BinaryOperator.Category.BITWISE) {
            throw unsupported(bitwiseName(op), "需要位向量理论");
        }
        Formula left = expr.getLeft().accept(this);
        Formula right = expr.getRight().accept(this);
        switch (op) {
            case ADD:
                return Formula.add(left, right);
            case SUB:
                return Formula.sub(left, right);
            case MUL:
                return Formula.mul(left, right);
            case DIV:
                return Formula.div(left, right);
            case MOD:
                return Formula.mod(left, right);
            case EQ:
                return Formula.eq(left, right);
            case NE:
                return Formula.ne(left, right);
            case LT:
                return Formula.lt(left, right);
            case LE:
                return Formula.le(left, right);
            case GT:
                return Formula.gt(left, right);
            case GE:
                return Formula.ge(left, right);
            case AND:
                return Formula.and(left, right);
            case OR:
                return Formula.or(left, right);
            case IMPLIES:
                return Formula.implies(left, right);
            default:
                throw new IllegalStateException("未处理的二元运算符: " + op);
        }
    }

    private static String bitwiseName(BinaryOperator op) {
        switch (op) {
            case BIT_AND:
                return "BitAnd";
            case BIT_OR:
                return "BitOr";
            default:
                return "BitXor";
        }
    }

    @Override
    public Formula visitUnaryOperation(UnaryOperation expr) throws UnsupportedConstructException {
        switch (expr.getOperator()) {
            case NEG: {
                Formula operand = expr.getOperand().accept(this);
                Formula zero = operand.getSort() == Sort.REAL ? Formula.real(0.0) : Formula.intConst(0);
                return Formula.sub(zero, operand);
            }
            case NOT:
                return Formula.not(expr.getOperand().accept(this));
            default:
                throw unsupported("BitNot", "需要位向量理论");
        }
    }

    @Override
    public Formula visitFunctionCall(FunctionCall expr) throws UnsupportedConstructException {
        throw unsupported("Call", "需要函数展开或未解释函数 (" + expr.getFunction() + ")");
    }

    @Override
    public Formula visitArrayAccess(ArrayAccess expr) throws UnsupportedConstructException {
        return Formula.select(expr.getArray().accept(this), expr.getIndex().accept(this));
    }

    @Override
    public Formula visitFieldAccess(FieldAccess expr) throws UnsupportedConstructException {
        throw unsupported("FieldAccess", "需要记录理论 (." + expr.getField() + ")");
    }

    @Override
    public Formula visitQuantifier(Quantifier expr) throws UnsupportedConstructException {
        List<SortedVariable> bound = new ArrayList<>(expr.getVariables().size());
        Map<String, Sort> inner = new HashMap<>(sorts);
        for (BoundVariable v : expr.getVariables()) {
            Sort sort = sortOf(v);
            bound.add(SortedVariable.of(v.getName(), sort));
            inner.put(v.getName(), sort);
        }
        Formula body = expr.getBody().accept(new ExpressionTranslator(inner));
        if (expr.getKind() == QuantifierKind.FORALL) {
            return Formula.forall(bound, body);
        }
        return Formula.exists(bound, body);
    }

    @Override
    public Formula visitOld(Old expr) throws UnsupportedConstructException {
        if (!(expr.getExpression() instanceof Variable)) {
            throw unsupported("Old", "old 只能作用于变量: " + expr);
        }
        String name = ((Variable) expr.getExpression()).getName();
        return Formula.var(oldName(name), sortOf(name));
    }

    @Override
    public Formula visitResult(ResultValue expr) {
        return Formula.var(RESULT_NAME, sortOf(RESULT_NAME));
    }

    @Override
    public Formula visitLength(Length expr) throws UnsupportedConstructException {
        throw unsupported("Length", "需要数组长度建模");
    }

    @Override
    public Formula visitIsType(IsType expr) throws UnsupportedConstructException {
        throw unsupported("IsType", "需要运行时类型信息");
    }

    @Override
    public Formula visitSemanticPredicate(SemanticPredicate expr) throws UnsupportedConstructException {
        throw unsupported("SemanticPredicate", "谓词 " + expr.getPredicate() + " 需要先展开定义");
    }

    @Override
    public Formula visitTemporal(Temporal expr) throws UnsupportedConstructException {
        throw unsupported("Temporal", "需要时序逻辑编码");
    }

    @Override
    public Formula visitInSet(InSet expr) throws UnsupportedConstructException {
        throw unsupported("InSet", "需要集合理论");
    }

    @Override
    public Formula visitRange(Range expr) throws UnsupportedConstructException {
        throw unsupported("Range", "需要集合理论");
    }

    @Override
    public Formula visitMatches(Matches expr) throws UnsupportedConstructException {
        throw unsupported("Matches", "需要字符串理论");
    }

    @Override
    public Formula visitAggregate(Aggregate expr) throws UnsupportedConstructException {
        throw unsupported("Aggregate", "需要数组理论上的归纳定义 (" + expr.getOperator().getKeyword() + ")");
    }

    @Override
    public Formula visitLet(Let expr) throws UnsupportedConstructException {
        return LetEliminator.eliminate(expr).accept(this);
    }
}

package org.aether.verification.vcgen;

import org.aether.verification.contract.*;
import org.aether.verification.core.MalformedInputException;
import org.aether.verification.core.PathLimitExceededException;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.core.UnsupportedConstructException;
import org.aether.verification.expressions.ContractExpression;
import org.aether.verification.formula.*;
import org.aether.verification.mir.*;
import org.aether.verification.translate.ExpressionTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 沿函数的控制流图做符号执行，生成验证条件。
 * <p>
 * 遍历使用显式工作表，每个工作项携带一个不可变的 {@link SymbolicState}。
 * 分支把谓词或其否定合取进路径条件；回到当前路径上祖先块的边视为回边。
 * 带 {@link LoopInvariant} 的循环头在首次到达时生成进入 VC，之后对循环体内被赋值的局部变量做 havoc 并假设不变量；
 * 回边生成保持 VC，有变式时再生成终止 VC。
 * <p>
 * 每次调用 {@link #generateFunctionVcs} 都使用独立的内部状态，但 VC 计数器在同一个生成器上单调递增。
 * 此类不是线程安全的。
 */
public class VcGenerator {

    private static final Logger logger = LoggerFactory.getLogger(VcGenerator.class);

    public static final int DEFAULT_MAX_PATHS = 4096;

    private final Map<Integer, LoopInvariant> loopInvariants;
    private final List<GlobalInvariant> globalInvariants;
    private final int maxPaths;

    private int vcCounter;
    private int freshCounter;

    public VcGenerator() {
        this(Collections.emptyList(), Collections.emptyList(), DEFAULT_MAX_PATHS);
    }

    /**
     * @param loopInvariants   本函数的循环不变量，按循环头块登记。
     * @param globalInvariants 全局不变量，按 {@link GlobalInvariant#appliesInFunction} 过滤。
     * @param maxPaths         单个函数允许探索的路径数上限。
     */
    public VcGenerator(Collection<LoopInvariant> loopInvariants, Collection<GlobalInvariant> globalInvariants, int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("路径上限必须为正: " + maxPaths);
        }
        this.loopInvariants = new HashMap<>();
        for (LoopInvariant invariant : loopInvariants) {
            this.loopInvariants.put(invariant.getLoopHeader(), invariant);
        }
        this.globalInvariants = List.copyOf(globalInvariants);
        this.maxPaths = maxPaths;
    }

    /**
     * 为一个函数生成全部验证条件。
     * @param function 降级后的函数。
     * @param contract 函数契约，可为 null。
     * @return 按生成顺序排列的 VC。
     * @throws UnsupportedConstructException 契约或 MIR 中有没有编码的构造。
     * @throws MalformedInputException       缺少入口块或跳转目标不存在。
     * @throws PathLimitExceededException    路径数超过上限。
     */
    public List<VerificationCondition> generateFunctionVcs(MirFunction function, FunctionContract contract)
            throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
        Objects.requireNonNull(function, "Function cannot be null.");
        if (function.getBlock(function.getEntryBlock()).isEmpty()) {
            throw new MalformedInputException("函数 " + function.getName() + " 缺少入口块 bb" + function.getEntryBlock());
        }
        try {
            return new FunctionWalk(function, contract).run();
        } catch (IllegalArgumentException e) {
            throw new UnsupportedConstructException("SortMismatch",
                    "函数 " + function.getName() + " 中的排序不匹配: " + e.getMessage());
        }
    }

    private String nextName(VcKind kind, String name) {
        return kind.getTag() + "_" + name + "#" + (++vcCounter);
    }

    private Formula fresh(String prefix, Sort sort) {
        return Formula.var(prefix + "_" + (++freshCounter), sort);
    }

    /**
     * 单个函数上的一次遍历。
     */
    private final class FunctionWalk {

        private final MirFunction function;
        private final FunctionContract contract;
        private final ExpressionTranslator translator;
        private final List<GlobalInvariant> applicableGlobals = new ArrayList<>();
        // 局部变量编号 -> 参数入口值
        private final Map<Integer, Formula> entryValues = new LinkedHashMap<>();
        private final List<VerificationCondition> vcs = new ArrayList<>();
        private final Deque<SymbolicState> worklist = new ArrayDeque<>();
        private int paths = 1;

        FunctionWalk(MirFunction function, FunctionContract contract) {
            this.function = function;
            this.contract = contract;
            this.translator = new ExpressionTranslator(sortEnvironment());
            for (GlobalInvariant invariant : globalInvariants) {
                if (invariant.appliesInFunction(function.getName())) {
                    applicableGlobals.add(invariant);
                }
            }
        }

        private Map<String, Sort> sortEnvironment() {
            Map<String, Sort> sorts = new HashMap<>();
            for (Local local : function.getLocals().values()) {
                sorts.put(nameOf(local.getId()), local.getType().getSort());
            }
            sorts.put(ExpressionTranslator.RESULT_NAME, function.typeOf(MirFunction.RETURN_LOCAL).getSort());
            for (int i = 0; i < function.getParameters().size(); i++) {
                int id = function.getParameters().get(i);
                sorts.put(ExpressionTranslator.oldName(parameterName(i, id)), function.typeOf(id).getSort());
            }
            return sorts;
        }

        private String nameOf(int local) {
            return function.getLocal(local).flatMap(Local::getName).orElse("local_" + local);
        }

        private String parameterName(int index, int local) {
            return function.getLocal(local).flatMap(Local::getName).orElse("param_" + index);
        }

        List<VerificationCondition> run()
                throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
            Map<Integer, Formula> store = new HashMap<>();
            for (int i = 0; i < function.getParameters().size(); i++) {
                int id = function.getParameters().get(i);
                Formula value = Formula.var(parameterName(i, id), function.typeOf(id).getSort());
                store.put(id, value);
                entryValues.put(id, value);
            }
            SymbolicState initial = SymbolicState.initial(function.getEntryBlock(), PathCondition.EMPTY, store);

            if (contract != null) {
                for (EnhancedCondition pre : contract.getPreconditions()) {
                    Formula f = evaluate(pre.getExpression(), initial);
                    if (pre.getVerificationHint().getKind() == VerificationHint.Kind.STATIC_CHECK) {
                        List<SortedVariable> free = new ArrayList<>();
                        f.freeVariables().forEach((name, sort) -> free.add(SortedVariable.of(name, sort)));
                        emit(VcKind.PRECONDITION, pre.getName(), Formula.exists(free, f), pre.getLocation(), initial);
                    }
                    initial = initial.assume(f);
                }
                for (EnhancedCondition inv : contract.getInvariants()) {
                    initial = initial.assume(evaluate(inv.getExpression(), initial));
                }
            }
            for (GlobalInvariant inv : applicableGlobals) {
                initial = initial.assume(evaluate(inv.getExpression(), initial));
            }

            SymbolicState entry = arrive(initial);
            if (entry != null) {
                worklist.push(entry);
            }
            while (!worklist.isEmpty()) {
                processBlock(worklist.pop());
            }
            logger.info("函数 {} 生成 {} 个验证条件，探索 {} 条路径", function.getName(), vcs.size(), paths);
            return vcs;
        }

        // --- 契约求值 ---

        /**
         * 翻译契约表达式，并把源码名称替换为当前状态中的符号值。
         */
        private Formula evaluate(ContractExpression expression, SymbolicState state) throws UnsupportedConstructException {
            return translator.translate(expression).substitute(bindings(state));
        }

        private Map<String, Formula> bindings(SymbolicState state) {
            Map<String, Formula> result = new HashMap<>();
            for (Local local : function.getLocals().values()) {
                if (local.getName().isPresent()) {
                    result.put(local.getName().get(), valueOf(state, local.getId()));
                }
            }
            result.put(ExpressionTranslator.RESULT_NAME, valueOf(state, MirFunction.RETURN_LOCAL));
            for (int i = 0; i < function.getParameters().size(); i++) {
                int id = function.getParameters().get(i);
                result.put(ExpressionTranslator.oldName(parameterName(i, id)), entryValues.get(id));
            }
            return result;
        }

        private Formula valueOf(SymbolicState state, int local) {
            return state.valueOf(local)
                    .orElseGet(() -> Formula.var(nameOf(local), function.typeOf(local).getSort()));
        }

        private void emit(VcKind kind, String name, Formula property, SourceLocation location, SymbolicState state) {
            VerificationCondition vc = new VerificationCondition(nextName(kind, name), kind,
                    state.getPathCondition().implies(property), location, state.getTrace());
            logger.debug("生成 VC {}", vc);
            vcs.add(vc);
        }

        // --- 块与语句 ---

        private void processBlock(SymbolicState state)
                throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
            BasicBlock block = function.getBlock(state.getBlock())
                    .orElseThrow(() -> new MalformedInputException("跳转到不存在的块 bb" + state.getBlock()));
            SymbolicState current = state;
            for (Statement statement : block.getStatements()) {
                current = processStatement(statement, current);
            }
            processTerminator(block.getTerminator(), current);
        }

        private SymbolicState processStatement(Statement statement, SymbolicState state) throws UnsupportedConstructException {
            if (statement.getKind() != Statement.Kind.ASSIGN) {
                return state;
            }
            Rvalue rvalue = statement.getRvalue();
            if (rvalue.getKind() == Rvalue.Kind.BINARY_OP && rvalue.getBinaryOp().isDivision()) {
                Formula divisor = operand(rvalue.getOperand(1), state);
                emit(VcKind.DIVISION_BY_ZERO, function.getName(), Formula.ne(divisor, Formula.intConst(0)),
                        statement.getLocation(), state);
            }
            Formula value = rvalue(rvalue, statement.getLocal(), state);
            return state.assign(statement.getLocal(), value);
        }

        private Formula rvalue(Rvalue rvalue, int destination, SymbolicState state) throws UnsupportedConstructException {
            Sort sort = function.typeOf(destination).getSort();
            switch (rvalue.getKind()) {
                case USE:
                case CAST:
                    return operand(rvalue.getOperand(0), state);
                case BINARY_OP:
                    return binary(rvalue.getBinaryOp(), operand(rvalue.getOperand(0), state),
                            operand(rvalue.getOperand(1), state), sort);
                case UNARY_OP: {
                    Formula x = operand(rvalue.getOperand(0), state);
                    if (rvalue.getUnaryOp() == MirUnaryOp.NEG) {
                        Formula zero = x.getSort() == Sort.REAL ? Formula.real(0.0) : Formula.intConst(0);
                        return Formula.sub(zero, x);
                    }
                    if (x.getSort() == Sort.BOOL) {
                        return Formula.not(x);
                    }
                    return opaque("bitwise_value", sort);
                }
                case CALL:
                    return opaque("call_result", sort);
                case AGGREGATE:
                    return opaque("aggregate_value", sort);
                case REF:
                    return opaque("ref_value", sort);
                case LEN:
                    return opaque("array_length", Sort.INT);
                default:
                    return opaque("enum_discriminant", sort);
            }
        }

        private Formula binary(MirBinaryOp op, Formula l, Formula r, Sort sort) {
            if (op.isOpaque()) {
                return opaque("bitwise_value", sort);
            }
            switch (op) {
                case ADD:
                    return Formula.add(l, r);
                case SUB:
                    return Formula.sub(l, r);
                case MUL:
                    return Formula.mul(l, r);
                case DIV:
                    return Formula.div(l, r);
                case REM:
                case MOD:
                    return Formula.mod(l, r);
                case EQ:
                    return Formula.eq(l, r);
                case NE:
                    return Formula.ne(l, r);
                case LT:
                    return Formula.lt(l, r);
                case LE:
                    return Formula.le(l, r);
                case GT:
                    return Formula.gt(l, r);
                case GE:
                    return Formula.ge(l, r);
                case AND:
                    return Formula.and(l, r);
                default:
                    return Formula.or(l, r);
            }
        }

        private Formula opaque(String prefix, Sort sort) {
            Formula value = fresh(prefix, sort);
            logger.debug("函数 {} 中引入不透明值 {}", function.getName(), value);
            return value;
        }

        private Formula operand(Operand operand, SymbolicState state) throws UnsupportedConstructException {
            if (!operand.isConstant()) {
                return valueOf(state, operand.getLocal());
            }
            MirConstant c = operand.getConstant();
            switch (c.getKind()) {
                case INT:
                    return Formula.intConst((Long) c.getValue());
                case FLOAT:
                    return Formula.real((Double) c.getValue());
                case BOOL:
                    return Formula.bool((Boolean) c.getValue());
                case CHAR:
                    return Formula.intConst((Integer) c.getValue());
                case STRING:
                    throw new UnsupportedConstructException("StringConstant", "MIR 字符串常量需要字符串理论: " + c);
                default:
                    throw new UnsupportedConstructException("NullConstant", "MIR 空常量需要引用模型");
            }
        }

        private Formula asPredicate(Formula value) {
            return value.getSort() == Sort.BOOL ? value : Formula.ne(value, Formula.intConst(0));
        }

        // --- 终结指令 ---

        private void processTerminator(Terminator terminator, SymbolicState state)
                throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
            switch (terminator.getKind()) {
                case RETURN:
                    checkReturn(state);
                    break;
                case GOTO:
                case DROP:
                    follow(state, terminator.getTarget());
                    break;
                case SWITCH_INT:
                    processSwitch(terminator, state);
                    break;
                case ASSERT: {
                    Formula condition = asPredicate(operand(terminator.getOperand(), state));
                    Formula asserted = terminator.isExpected() ? condition : Formula.negate(condition);
                    emit(VcKind.ASSERTION, function.getName(), asserted, terminator.getLocation(), state);
                    follow(state.assume(asserted), terminator.getTarget());
                    break;
                }
                case CALL:
                    processCall(terminator, state);
                    break;
                default:
                    // UNREACHABLE
                    break;
            }
        }

        private void checkReturn(SymbolicState state) throws UnsupportedConstructException {
            if (contract != null) {
                for (EnhancedCondition post : contract.getPostconditions()) {
                    if (post.getVerificationHint().isRuntimeOnly()) {
                        continue;
                    }
                    emit(VcKind.POSTCONDITION, post.getName(), evaluate(post.getExpression(), state), post.getLocation(), state);
                }
                for (EnhancedCondition inv : contract.getInvariants()) {
                    emit(VcKind.INVARIANT, inv.getName(), evaluate(inv.getExpression(), state), inv.getLocation(), state);
                }
            }
            for (GlobalInvariant inv : applicableGlobals) {
                emit(VcKind.INVARIANT, inv.getName(), evaluate(inv.getExpression(), state), inv.getLocation(), state);
            }
        }

        private void processSwitch(Terminator terminator, SymbolicState state)
                throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
            List<Long> values = terminator.getValues();
            if (values.size() == 1) {
                Formula discriminant = operand(terminator.getOperand(), state);
                long value = values.get(0);
                Formula whenValue;
                Formula otherwise;
                if (discriminant.getSort() == Sort.BOOL) {
                    if (value != 0L && value != 1L) {
                        // 布尔判别式只能取 0 或 1，其他取值的目标不可达
                        follow(state, terminator.getTarget());
                        return;
                    }
                    whenValue = value == 1L ? discriminant : Formula.negate(discriminant);
                    otherwise = Formula.negate(whenValue);
                } else {
                    whenValue = Formula.eq(discriminant, Formula.intConst(value));
                    otherwise = Formula.ne(discriminant, Formula.intConst(value));
                }
                fork(1);
                // 先压 otherwise，使 then 分支先被处理
                follow(state.assume(otherwise), terminator.getTarget());
                follow(state.assume(whenValue), terminator.getTargets().get(0));
                return;
            }
            List<Integer> successors = terminator.successors();
            logger.warn("函数 {} 的 bb{} 是多路 switch，{} 个后继不附加分支条件", function.getName(), state.getBlock(),
                    successors.size());
            fork(successors.size() - 1);
            for (int i = successors.size() - 1; i >= 0; i--) {
                follow(state, successors.get(i));
            }
        }

        private void processCall(Terminator terminator, SymbolicState state)
                throws UnsupportedConstructException, MalformedInputException, PathLimitExceededException {
            if (contract != null && contract.getDecreases().isPresent()
                    && terminator.getFunction().equals(function.getName())) {
                checkRecursiveDecrease(terminator, state);
            }
            SymbolicState next = state;
            if (terminator.getLocal() >= 0) {
                next = state.assign(terminator.getLocal(), opaque("call_result", function.typeOf(terminator.getLocal()).getSort()));
            }
            Optional<Integer> target = terminator.getReturnTarget();
            if (target.isPresent()) {
                follow(next, target.get());
            }
        }

        private void checkRecursiveDecrease(Terminator terminator, SymbolicState state) throws UnsupportedConstructException {
            ContractExpression measure = contract.getDecreases().get();
            Formula atEntry = translator.translate(measure).substitute(bindings(initialBindingsState()));
            Map<String, Formula> argumentBindings = new HashMap<>(bindings(state));
            List<Operand> arguments = terminator.getArguments();
            for (int i = 0; i < function.getParameters().size() && i < arguments.size(); i++) {
                int id = function.getParameters().get(i);
                argumentBindings.put(parameterName(i, id), operand(arguments.get(i), state));
            }
            Formula atCall = translator.translate(measure).substitute(argumentBindings);
            Formula decreases = Formula.and(Formula.le(Formula.intConst(0), atCall), Formula.lt(atCall, atEntry));
            emit(VcKind.TERMINATION, function.getName(), decreases, terminator.getLocation(), state);
        }

        private SymbolicState initialBindingsState() {
            return SymbolicState.initial(function.getEntryBlock(), PathCondition.EMPTY, entryValues);
        }

        private void fork(int extra) throws PathLimitExceededException {
            paths += extra;
            if (paths > maxPaths) {
                throw new PathLimitExceededException(function.getName(), maxPaths);
            }
        }

        /**
         * 沿边进入目标块，处理回边与循环头，然后把后继状态放入工作表。
         */
        private void follow(SymbolicState state, int target) throws UnsupportedConstructException, MalformedInputException {
            if (function.getBlock(target).isEmpty()) {
                throw new MalformedInputException("bb" + state.getBlock() + " 跳转到不存在的块 bb" + target);
            }
            if (state.isBackEdgeTo(target)) {
                backEdge(state, target);
                return;
            }
            SymbolicState next = arrive(state.moveTo(target));
            if (next != null) {
                worklist.push(next);
            }
        }

        /**
         * 首次到达一个块。循环头在这里生成进入 VC 并建立循环假设。
         * @return 继续遍历的状态。
         */
        private SymbolicState arrive(SymbolicState state) throws UnsupportedConstructException {
            LoopInvariant invariant = loopInvariants.get(state.getBlock());
            if (invariant == null) {
                return state;
            }
            int header = state.getBlock();
            for (InvariantCondition condition : invariant.getConditions()) {
                emit(VcKind.LOOP_INVARIANT_ENTRY, condition.getName(), evaluate(condition.getExpression(), state),
                        condition.getLocation(), state);
            }
            SymbolicState havocked = state;
            for (int local : assignedInLoop(header)) {
                havocked = havocked.assign(local, fresh(nameOf(local) + "_loop" + header, function.typeOf(local).getSort()));
            }
            for (InvariantCondition condition : invariant.getConditions()) {
                havocked = havocked.assume(evaluate(condition.getExpression(), havocked));
            }
            Optional<LoopVariant> variant = invariant.getVariant();
            if (variant.isPresent()) {
                havocked = havocked.withVariantAtHead(header, evaluate(variant.get().getExpression(), havocked));
            }
            logger.debug("进入循环头 bb{}，havoc 后状态 {}", header, havocked);
            return havocked;
        }

        private void backEdge(SymbolicState state, int header) throws UnsupportedConstructException {
            LoopInvariant invariant = loopInvariants.get(header);
            if (invariant == null) {
                logger.warn("函数 {} 中 bb{} -> bb{} 是回边，但循环头没有不变量，循环体只验证了第一次迭代",
                        function.getName(), state.getBlock(), header);
                return;
            }
            for (InvariantCondition condition : invariant.getConditions()) {
                emit(VcKind.LOOP_INVARIANT_PRESERVATION, condition.getName(), evaluate(condition.getExpression(), state),
                        condition.getLocation(), state);
            }
            Optional<LoopVariant> variant = invariant.getVariant();
            Formula atHead = state.getVariantsAtHead().get(header);
            if (variant.isPresent() && atHead != null) {
                Formula now = evaluate(variant.get().getExpression(), state);
                Formula lower = evaluate(variant.get().getLowerBound(), state);
                emit(VcKind.TERMINATION, "loop_bb" + header,
                        Formula.and(Formula.lt(now, atHead), Formula.ge(now, lower)),
                        SourceLocation.UNKNOWN, state);
            }
        }

        /**
         * 自然循环近似：既能从循环头到达、又能回到循环头的块中被赋值的局部变量。
         */
        private Set<Integer> assignedInLoop(int header) {
            Set<Integer> forward = reachableFrom(header);
            Set<Integer> result = new TreeSet<>();
            for (int id : forward) {
                if (!reachableFrom(id).contains(header)) {
                    continue;
                }
                BasicBlock block = function.getBlocks().get(id);
                for (Statement statement : block.getStatements()) {
                    if (statement.getKind() == Statement.Kind.ASSIGN) {
                        result.add(statement.getLocal());
                    }
                }
                Terminator terminator = block.getTerminator();
                if (terminator.getKind() == Terminator.Kind.CALL && terminator.getLocal() >= 0) {
                    result.add(terminator.getLocal());
                }
            }
            return result;
        }

        private Set<Integer> reachableFrom(int start) {
            Set<Integer> seen = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            for (int successor : successorsOf(start)) {
                stack.push(successor);
            }
            while (!stack.isEmpty()) {
                int id = stack.pop();
                if (!seen.add(id)) {
                    continue;
                }
                for (int successor : successorsOf(id)) {
                    stack.push(successor);
                }
            }
            return seen;
        }

        private List<Integer> successorsOf(int id) {
            BasicBlock block = function.getBlocks().get(id);
            return block == null ? List.of() : block.getTerminator().successors();
        }
    }
}

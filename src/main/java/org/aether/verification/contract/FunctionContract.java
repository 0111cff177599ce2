package org.aether.verification.contract;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.expressions.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 函数契约：前置条件、后置条件、函数不变量、modifies 集合、纯度、
 * 可选的 decreases 度量，以及失败动作索引和派生的证明义务。
 * <p>
 * 每个已登记条件（前置、后置、不变量）的名称都出现在失败动作索引中；
 * 同一列表内名称唯一。
 */
@Getter
public final class FunctionContract {

    private static final Logger logger = LoggerFactory.getLogger(FunctionContract.class);

    private final String functionName;
    private final List<EnhancedCondition> preconditions = new ArrayList<>();
    private final List<EnhancedCondition> postconditions = new ArrayList<>();
    private final List<EnhancedCondition> invariants = new ArrayList<>();
    private final Set<String> modifies = new LinkedHashSet<>();
    private boolean pure;
    // 可为 null
    private ContractExpression decreases;
    private final Map<String, FailureAction> failureActions = new LinkedHashMap<>();
    private List<ProofObligation> proofObligations = List.of();

    public FunctionContract(String functionName) {
        this.functionName = Objects.requireNonNull(functionName, "Function name cannot be null.");
    }

    // --- 前置条件 ---

    public FunctionContract addPrecondition(String name, ContractExpression expression, SourceLocation location) {
        return addEnhancedPrecondition(name, expression, location, null,
                FailureAction.throwException("Precondition violation"), VerificationHint.SMT_SOLVER);
    }

    public FunctionContract addEnhancedPrecondition(String name, ContractExpression expression, SourceLocation location,
                                                    String proofHint, FailureAction failureAction,
                                                    VerificationHint verificationHint) {
        register(preconditions, EnhancedCondition.of(name, expression, location, proofHint, failureAction, verificationHint), "前置条件");
        return this;
    }

    // --- 后置条件 ---

    public FunctionContract addPostcondition(String name, ContractExpression expression, SourceLocation location) {
        return addEnhancedPostcondition(name, expression, location, null,
                FailureAction.throwException("Postcondition violation"), VerificationHint.SMT_SOLVER);
    }

    public FunctionContract addEnhancedPostcondition(String name, ContractExpression expression, SourceLocation location,
                                                     String proofHint, FailureAction failureAction,
                                                     VerificationHint verificationHint) {
        register(postconditions, EnhancedCondition.of(name, expression, location, proofHint, failureAction, verificationHint), "后置条件");
        return this;
    }

    // --- 不变量 ---

    public FunctionContract addInvariant(String name, ContractExpression expression, SourceLocation location, String proofHint) {
        register(invariants, EnhancedCondition.of(name, expression, location, proofHint,
                FailureAction.ABORT, VerificationHint.SMT_SOLVER), "不变量");
        return this;
    }

    private void register(List<EnhancedCondition> target, EnhancedCondition condition, String category) {
        for (EnhancedCondition existing : target) {
            if (existing.getName().equals(condition.getName())) {
                throw new IllegalArgumentException(functionName + " 的" + category + "名称重复: " + condition.getName());
            }
        }
        target.add(condition);
        failureActions.put(condition.getName(), condition.getFailureAction());
        logger.debug("{} 登记{} {}", functionName, category, condition);
    }

    public FunctionContract addModifies(String variable) {
        modifies.add(Objects.requireNonNull(variable, "Variable cannot be null."));
        return this;
    }

    public FunctionContract setPure(boolean pure) {
        this.pure = pure;
        return this;
    }

    public FunctionContract setDecreases(ContractExpression measure) {
        this.decreases = Objects.requireNonNull(measure, "Decreases measure cannot be null.");
        return this;
    }

    public Optional<ContractExpression> getDecreases() {
        return Optional.ofNullable(decreases);
    }

    public List<EnhancedCondition> getPreconditions() {
        return Collections.unmodifiableList(preconditions);
    }

    public List<EnhancedCondition> getPostconditions() {
        return Collections.unmodifiableList(postconditions);
    }

    public List<EnhancedCondition> getInvariants() {
        return Collections.unmodifiableList(invariants);
    }

    public Set<String> getModifies() {
        return Collections.unmodifiableSet(modifies);
    }

    public Map<String, FailureAction> getFailureActions() {
        return Collections.unmodifiableMap(failureActions);
    }

    public Optional<FailureAction> getFailureAction(String conditionName) {
        return Optional.ofNullable(failureActions.get(conditionName));
    }

    public List<ContractExpression> getPreconditionExpressions() {
        List<ContractExpression> result = new ArrayList<>(preconditions.size());
        for (EnhancedCondition pre : preconditions) {
            result.add(pre.getExpression());
        }
        return result;
    }

    /**
     * 从当前契约生成证明义务，并替换之前生成的结果。
     * 对同一契约重复调用得到相同内容。自由变量一律按整数约束。
     * @return 按前置、后置、decreases 顺序排列的证明义务。
     */
    public List<ProofObligation> generateProofObligations() {
        return generateProofObligations(Collections.emptyMap());
    }

    /**
     * @param variableTypes 自由变量名到值类型的映射，未列出的变量按整数约束。
     */
    public List<ProofObligation> generateProofObligations(Map<String, ValueType> variableTypes) {
        Objects.requireNonNull(variableTypes, "Variable types cannot be null.");
        List<ProofObligation> obligations = new ArrayList<>();

        for (int i = 0; i < preconditions.size(); i++) {
            EnhancedCondition pre = preconditions.get(i);
            List<BoundVariable> free = new ArrayList<>();
            for (String name : FreeVariables.of(pre.getExpression())) {
                free.add(BoundVariable.of(name, variableTypes.getOrDefault(name, ValueType.INTEGER)));
            }
            obligations.add(new ProofObligation(
                    functionName + "_pre_" + i,
                    "Precondition '" + pre.getName() + "' is satisfiable",
                    Quantifier.exists(free, pre.getExpression()),
                    List.of(),
                    preconditionMethod(pre.getVerificationHint()),
                    VerificationPriority.HIGH));
        }

        List<ContractExpression> assumptions = getPreconditionExpressions();
        ContractExpression assumed = ContractExpression.conjunction(assumptions);
        for (int i = 0; i < postconditions.size(); i++) {
            EnhancedCondition post = postconditions.get(i);
            obligations.add(new ProofObligation(
                    functionName + "_post_" + i,
                    "Postcondition '" + post.getName() + "' holds when preconditions are met",
                    BinaryOperation.of(BinaryOperator.IMPLIES, assumed, post.getExpression()),
                    assumptions,
                    post.getVerificationHint().getKind() == VerificationHint.Kind.SMT_SOLVER
                            ? VerificationMethod.Z3_SOLVER : VerificationMethod.DIRECT_PROOF,
                    VerificationPriority.CRITICAL));
        }

        if (decreases != null) {
            obligations.add(new ProofObligation(
                    functionName + "_decreases",
                    "Decreases measure '" + decreases + "' is bounded below by zero",
                    BinaryOperation.of(BinaryOperator.IMPLIES, assumed,
                            BinaryOperation.of(BinaryOperator.GE, decreases, Constant.ofInteger(0))),
                    assumptions,
                    VerificationMethod.INDUCTION,
                    VerificationPriority.MEDIUM));
        }

        this.proofObligations = List.copyOf(obligations);
        logger.debug("{} 生成 {} 个证明义务", functionName, obligations.size());
        return proofObligations;
    }

    private static VerificationMethod preconditionMethod(VerificationHint hint) {
        switch (hint.getKind()) {
            case SMT_SOLVER:
                return VerificationMethod.Z3_SOLVER;
            case SYMBOLIC_EXECUTION:
                return VerificationMethod.SYMBOLIC_EXECUTION;
            default:
                return VerificationMethod.DIRECT_PROOF;
        }
    }

    @Override
    public String toString() {
        return "FunctionContract{" + functionName
                + ", pre=" + preconditions
                + ", post=" + postconditions
                + ", inv=" + invariants
                + (decreases != null ? ", decreases=" + decreases : "")
                + "}";
    }
}

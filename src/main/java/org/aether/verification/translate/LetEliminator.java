package org.aether.verification.translate;

import org.aether.verification.expressions.*;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 通过替换消去 let 绑定。
 * 绑定按顺序展开，后面的绑定值先用前面的绑定替换；
 * 在量词下，如果替换值的自由变量与约束变量重名，约束变量会被改名。
 */
public final class LetEliminator implements ContractExpressionVisitor<ContractExpression, RuntimeException> {

    private final Map<String, ContractExpression> substitution;

    private LetEliminator(Map<String, ContractExpression> substitution) {
        this.substitution = substitution;
    }

    /**
     * @return 不含 Let 节点、与原表达式语义相同的表达式。
     */
    public static ContractExpression eliminate(ContractExpression expression) {
        return expression.accept(new LetEliminator(Collections.emptyMap()));
    }

    /**
     * 同时替换表达式中的自由变量，并消去沿途的 let。
     */
    public static ContractExpression substitute(ContractExpression expression, Map<String, ContractExpression> substitution) {
        return expression.accept(new LetEliminator(Map.copyOf(substitution)));
    }

    private ContractExpression apply(ContractExpression expression) {
        return expression.accept(this);
    }

    private List<ContractExpression> applyAll(List<ContractExpression> expressions) {
        return expressions.stream().map(this::apply).collect(Collectors.toList());
    }

    @Override
    public ContractExpression visitVariable(Variable expr) {
        return substitution.getOrDefault(expr.getName(), expr);
    }

    @Override
    public ContractExpression visitConstant(Constant expr) {
        return expr;
    }

    @Override
    public ContractExpression visitBinaryOperation(BinaryOperation expr) {
        return BinaryOperation.of(expr.getOperator(), apply(expr.getLeft()), apply(expr.getRight()));
    }

    @Override
    public ContractExpression visitUnaryOperation(UnaryOperation expr) {
        return UnaryOperation.of(expr.getOperator(), apply(expr.getOperand()));
    }

    @Override
    public ContractExpression visitFunctionCall(FunctionCall expr) {
        return FunctionCall.of(expr.getFunction(), applyAll(expr.getArguments()));
    }

    @Override
    public ContractExpression visitArrayAccess(ArrayAccess expr) {
        return ArrayAccess.of(apply(expr.getArray()), apply(expr.getIndex()));
    }

    @Override
    public ContractExpression visitFieldAccess(FieldAccess expr) {
        return FieldAccess.of(apply(expr.getObject()), expr.getField());
    }

    @Override
    public ContractExpression visitQuantifier(Quantifier expr) {
        Map<String, ContractExpression> inner = new HashMap<>(substitution);
        for (BoundVariable v : expr.getVariables()) {
            inner.remove(v.getName());
        }
        if (inner.isEmpty()) {
            // 仍需消去体内的 let
            return Quantifier.of(expr.getKind(), expr.getVariables(), eliminate(expr.getBody()));
        }
        Set<String> captured = new HashSet<>();
        for (ContractExpression replacement : inner.values()) {
            captured.addAll(FreeVariables.of(replacement));
        }
        Set<String> avoid = new HashSet<>(captured);
        avoid.addAll(FreeVariables.of(expr.getBody()));
        List<BoundVariable> renamed = new ArrayList<>(expr.getVariables().size());
        for (BoundVariable v : expr.getVariables()) {
            if (!captured.contains(v.getName())) {
                renamed.add(v);
                continue;
            }
            String fresh = v.getName();
            int suffix = 1;
            while (avoid.contains(fresh)) {
                fresh = v.getName() + "_" + suffix++;
            }
            avoid.add(fresh);
            inner.put(v.getName(), Variable.of(fresh));
            renamed.add(BoundVariable.of(fresh, v.getType()));
        }
        ContractExpression body = expr.getBody().accept(new LetEliminator(inner));
        return Quantifier.of(expr.getKind(), renamed, body);
    }

    @Override
    public ContractExpression visitOld(Old expr) {
        return Old.of(apply(expr.getExpression()));
    }

    @Override
    public ContractExpression visitResult(ResultValue expr) {
        return expr;
    }

    @Override
    public ContractExpression visitLength(Length expr) {
        return Length.of(apply(expr.getExpression()));
    }

    @Override
    public ContractExpression visitIsType(IsType expr) {
        return IsType.of(apply(expr.getExpression()), expr.getType());
    }

    @Override
    public ContractExpression visitSemanticPredicate(SemanticPredicate expr) {
        return SemanticPredicate.of(expr.getPredicate(), applyAll(expr.getArguments()));
    }

    @Override
    public ContractExpression visitTemporal(Temporal expr) {
        return Temporal.of(expr.getOperator(), apply(expr.getExpression()));
    }

    @Override
    public ContractExpression visitInSet(InSet expr) {
        return InSet.of(apply(expr.getElement()), apply(expr.getSet()));
    }

    @Override
    public ContractExpression visitRange(Range expr) {
        return Range.of(apply(expr.getStart()), apply(expr.getEnd()), expr.isInclusive());
    }

    @Override
    public ContractExpression visitMatches(Matches expr) {
        return Matches.of(apply(expr.getExpression()), expr.getPattern());
    }

    @Override
    public ContractExpression visitAggregate(Aggregate expr) {
        ContractExpression collection = apply(expr.getCollection());
        Optional<ContractExpression> filter = expr.getFilter();
        if (filter.isPresent()) {
            return Aggregate.of(expr.getOperator(), collection, apply(filter.get()));
        }
        return Aggregate.of(expr.getOperator(), collection);
    }

    @Override
    public ContractExpression visitLet(Let expr) {
        Map<String, ContractExpression> extended = new HashMap<>(substitution);
        for (Pair<String, ContractExpression> binding : expr.getBindings()) {
            ContractExpression value = binding.getValue().accept(new LetEliminator(extended));
            extended.put(binding.getKey(), value);
        }
        return expr.getBody().accept(new LetEliminator(extended));
    }
}

package org.aether.verification.expressions;

import org.apache.commons.lang3.tuple.Pair;

import java.util.*;

/**
 * 收集契约表达式中的自由变量名（不含量词与 let 约束的名称），按首次出现的顺序。
 * old(x) 与 result 不算作自由变量。
 */
public final class FreeVariables implements ContractExpressionVisitor<Void, RuntimeException> {

    private final Set<String> result = new LinkedHashSet<>();
    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    private FreeVariables() {
    }

    public static Set<String> of(ContractExpression expression) {
        FreeVariables collector = new FreeVariables();
        expression.accept(collector);
        return Collections.unmodifiableSet(collector.result);
    }

    private boolean isBound(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private Void visitAll(List<ContractExpression> expressions) {
        for (ContractExpression e : expressions) {
            e.accept(this);
        }
        return null;
    }

    @Override
    public Void visitVariable(Variable expr) {
        if (!isBound(expr.getName())) {
            result.add(expr.getName());
        }
        return null;
    }

    @Override
    public Void visitConstant(Constant expr) {
        return null;
    }

    @Override
    public Void visitBinaryOperation(BinaryOperation expr) {
        expr.getLeft().accept(this);
        return expr.getRight().accept(this);
    }

    @Override
    public Void visitUnaryOperation(UnaryOperation expr) {
        return expr.getOperand().accept(this);
    }

    @Override
    public Void visitFunctionCall(FunctionCall expr) {
        return visitAll(expr.getArguments());
    }

    @Override
    public Void visitArrayAccess(ArrayAccess expr) {
        expr.getArray().accept(this);
        return expr.getIndex().accept(this);
    }

    @Override
    public Void visitFieldAccess(FieldAccess expr) {
        return expr.getObject().accept(this);
    }

    @Override
    public Void visitQuantifier(Quantifier expr) {
        Set<String> scope = new HashSet<>();
        for (BoundVariable v : expr.getVariables()) {
            scope.add(v.getName());
        }
        scopes.push(scope);
        try {
            return expr.getBody().accept(this);
        } finally {
            scopes.pop();
        }
    }

    @Override
    public Void visitOld(Old expr) {
        return null;
    }

    @Override
    public Void visitResult(ResultValue expr) {
        return null;
    }

    @Override
    public Void visitLength(Length expr) {
        return expr.getExpression().accept(this);
    }

    @Override
    public Void visitIsType(IsType expr) {
        return expr.getExpression().accept(this);
    }

    @Override
    public Void visitSemanticPredicate(SemanticPredicate expr) {
        return visitAll(expr.getArguments());
    }

    @Override
    public Void visitTemporal(Temporal expr) {
        return expr.getExpression().accept(this);
    }

    @Override
    public Void visitInSet(InSet expr) {
        expr.getElement().accept(this);
        return expr.getSet().accept(this);
    }

    @Override
    public Void visitRange(Range expr) {
        expr.getStart().accept(this);
        return expr.getEnd().accept(this);
    }

    @Override
    public Void visitMatches(Matches expr) {
        return expr.getExpression().accept(this);
    }

    @Override
    public Void visitAggregate(Aggregate expr) {
        expr.getCollection().accept(this);
        expr.getFilter().ifPresent(f -> f.accept(this));
        return null;
    }

    @Override
    public Void visitLet(Let expr) {
        // 绑定依次进入作用域，后面的绑定值可以引用前面的名称
        Set<String> scope = new HashSet<>();
        scopes.push(scope);
        try {
            for (Pair<String, ContractExpression> binding : expr.getBindings()) {
                binding.getValue().accept(this);
                scope.add(binding.getKey());
            }
            return expr.getBody().accept(this);
        } finally {
            scopes.pop();
        }
    }
}

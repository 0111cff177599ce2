package org.aether.verification.formula;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 路径条件：从函数入口到当前程序点所经过的分支谓词（以及前置条件假设）的合取。
 * 内部保持加入顺序，便于读出反例路径。
 * 此类是不可变的，and 操作返回新实例，因此工作表中的每个状态可以安全地共享前缀。
 */
@Getter
public final class PathCondition {

    private static final Logger logger = LoggerFactory.getLogger(PathCondition.class);

    // 预定义常量：表示恒真的空路径条件
    public static final PathCondition EMPTY = new PathCondition(Collections.emptyList());

    private final List<Formula> conjuncts;

    private final int hashCode;

    private PathCondition(List<Formula> conjuncts) {
        Objects.requireNonNull(conjuncts, "Conjuncts cannot be null.");
        this.conjuncts = List.copyOf(conjuncts);
        this.hashCode = Objects.hash(this.conjuncts);
    }

    /**
     * 工厂方法：从一组布尔公式创建路径条件。
     * @param conjuncts 构成路径条件的合取项。
     * @return PathCondition 实例。
     */
    public static PathCondition of(List<Formula> conjuncts) {
        for (Formula f : conjuncts) {
            if (f.getSort() != Sort.BOOL) {
                throw new IllegalArgumentException("路径条件只能包含布尔公式: " + f);
            }
        }
        return new PathCondition(conjuncts);
    }

    /**
     * 将此路径条件与另一个谓词合取。恒真谓词不会被加入。
     * @param predicate 新的分支谓词。
     * @return 合取后的新 PathCondition。
     */
    public PathCondition and(Formula predicate) {
        if (predicate.getSort() != Sort.BOOL) {
            throw new IllegalArgumentException("路径条件只能包含布尔公式: " + predicate);
        }
        if (predicate.isTrue()) {
            return this;
        }
        List<Formula> extended = new ArrayList<>(conjuncts);
        extended.add(predicate);
        logger.debug("路径条件 {} 合取 {}", this, predicate);
        return new PathCondition(extended);
    }

    /**
     * 将一组谓词依次合取到此路径条件。
     */
    public PathCondition andAll(Collection<Formula> predicates) {
        PathCondition result = this;
        for (Formula predicate : predicates) {
            result = result.and(predicate);
        }
        return result;
    }

    public boolean isEmpty() {
        return conjuncts.isEmpty();
    }

    public int size() {
        return conjuncts.size();
    }

    /**
     * @return 整个路径条件对应的公式。空条件为 true，单个合取项为其自身。
     */
    public Formula toFormula() {
        if (conjuncts.isEmpty()) {
            return Formula.TRUE;
        }
        if (conjuncts.size() == 1) {
            return conjuncts.get(0);
        }
        return Formula.and(conjuncts);
    }

    /**
     * 构造 "路径条件 ⇒ property" 形式的验证公式。
     * 路径条件为空时直接返回 property。
     */
    public Formula implies(Formula property) {
        if (conjuncts.isEmpty()) {
            return property;
        }
        return Formula.implies(toFormula(), property);
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
        PathCondition that = (PathCondition) o;
        return conjuncts.equals(that.conjuncts);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (conjuncts.isEmpty()) {
            return "TRUE";
        }
        return "(" +
                conjuncts.stream()
                        .map(Formula::toString)
                        .collect(Collectors.joining(" /\\ ")) +
                ")";
    }
}

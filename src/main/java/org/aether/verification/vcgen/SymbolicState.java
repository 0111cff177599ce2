package org.aether.verification.vcgen;

import lombok.Getter;
import org.aether.verification.formula.Formula;
import org.aether.verification.formula.PathCondition;

import java.util.*;

/**
 * 代表 CFG 遍历中的一个符号化状态，即 (bb, PC, σ)。
 * 同时记录当前路径上的祖先块（用于识别回边）、块轨迹，以及各循环头处的变式取值。
 * 此类是不可变的，修改操作返回新实例。
 */
@Getter
public final class SymbolicState {

    private final int block;
    private final PathCondition pathCondition;
    // 局部变量编号 -> 符号值
    private final Map<Integer, Formula> store;
    private final Set<Integer> ancestors;
    private final List<Integer> trace;
    // 循环头块编号 -> 进入循环时的变式值
    private final Map<Integer, Formula> variantsAtHead;

    private final int hashCode;

    private SymbolicState(int block, PathCondition pathCondition, Map<Integer, Formula> store, Set<Integer> ancestors,
                          List<Integer> trace, Map<Integer, Formula> variantsAtHead) {
        this.block = block;
        this.pathCondition = Objects.requireNonNull(pathCondition, "Path condition cannot be null.");
        this.store = Collections.unmodifiableMap(store);
        this.ancestors = Collections.unmodifiableSet(ancestors);
        this.trace = Collections.unmodifiableList(trace);
        this.variantsAtHead = Collections.unmodifiableMap(variantsAtHead);
        this.hashCode = Objects.hash(block, pathCondition, this.store, this.trace);
    }

    public static SymbolicState initial(int entryBlock, PathCondition pathCondition, Map<Integer, Formula> store) {
        return new SymbolicState(entryBlock, pathCondition, new HashMap<>(store), new HashSet<>(),
                List.of(entryBlock), new HashMap<>());
    }

    public Optional<Formula> valueOf(int local) {
        return Optional.ofNullable(store.get(local));
    }

    /**
     * @return 当前块在本路径上是否已经作为祖先出现过。
     */
    public boolean isBackEdgeTo(int target) {
        return target == block || ancestors.contains(target);
    }

    public SymbolicState assign(int local, Formula value) {
        Map<Integer, Formula> next = new HashMap<>(store);
        next.put(local, value);
        return new SymbolicState(block, pathCondition, next, new HashSet<>(ancestors), new ArrayList<>(trace),
                new HashMap<>(variantsAtHead));
    }

    public SymbolicState assume(Formula predicate) {
        return new SymbolicState(block, pathCondition.and(predicate), new HashMap<>(store), new HashSet<>(ancestors),
                new ArrayList<>(trace), new HashMap<>(variantsAtHead));
    }

    public SymbolicState withVariantAtHead(int header, Formula value) {
        Map<Integer, Formula> next = new HashMap<>(variantsAtHead);
        next.put(header, value);
        return new SymbolicState(block, pathCondition, new HashMap<>(store), new HashSet<>(ancestors),
                new ArrayList<>(trace), next);
    }

    /**
     * 沿一条边移动到后继块，当前块成为祖先。
     */
    public SymbolicState moveTo(int target) {
        Set<Integer> nextAncestors = new HashSet<>(ancestors);
        nextAncestors.add(block);
        List<Integer> nextTrace = new ArrayList<>(trace);
        nextTrace.add(target);
        return new SymbolicState(target, pathCondition, new HashMap<>(store), nextAncestors, nextTrace,
                new HashMap<>(variantsAtHead));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicState that = (SymbolicState) o;
        return block == that.block
                && pathCondition.equals(that.pathCondition)
                && store.equals(that.store)
                && ancestors.equals(that.ancestors)
                && trace.equals(that.trace)
                && variantsAtHead.equals(that.variantsAtHead);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "SymbolicState(\n  Block: bb" + block + ",\n  PC: " + pathCondition + ",\n  Store: " + store + "\n)";
    }
}

package org.aether.verification.formula;

import lombok.Getter;

import java.util.Objects;

/**
 * 带排序的变量，用作量词的约束变量。
 * 此类是不可变的。
 */
@Getter
public final class SortedVariable {

    private final String name;
    private final Sort sort;

    private SortedVariable(String name, Sort sort) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
        this.sort = Objects.requireNonNull(sort, "Sort cannot be null.");
    }

    public static SortedVariable of(String name, Sort sort) {
        return new SortedVariable(name, sort);
    }

    public Formula toFormula() {
        return Formula.var(name, sort);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SortedVariable that = (SortedVariable) o;
        return name.equals(that.name) && sort == that.sort;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sort);
    }

    @Override
    public String toString() {
        return name + ":" + sort.getSmtName();
    }
}

package org.aether.verification.vcgen;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;
import org.aether.verification.formula.Formula;

import java.util.List;
import java.util.Objects;

/**
 * 一个待证明有效的公式，通常形如 "路径条件 ⇒ 性质"。
 * trace 记录生成它的路径上经过的基本块。
 * 此类是不可变的。
 */
@Getter
public final class VerificationCondition {

    private final String name;
    private final VcKind kind;
    private final Formula formula;
    private final SourceLocation location;
    private final List<Integer> trace;

    public VerificationCondition(String name, VcKind kind, Formula formula, SourceLocation location, List<Integer> trace) {
        this.name = Objects.requireNonNull(name, "VC name cannot be null.");
        this.kind = Objects.requireNonNull(kind, "VC kind cannot be null.");
        this.formula = Objects.requireNonNull(formula, "VC formula cannot be null.");
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.trace = List.copyOf(trace);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VerificationCondition that = (VerificationCondition) o;
        return name.equals(that.name) && kind == that.kind && formula.equals(that.formula)
                && location.equals(that.location) && trace.equals(that.trace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, formula, location, trace);
    }

    @Override
    public String toString() {
        return name + " (" + kind + "): " + formula;
    }
}

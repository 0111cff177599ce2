package org.aether.verification.engine;

import lombok.Getter;
import org.aether.verification.solver.SolverValue;

import java.util.*;

/**
 * 被反驳的条件的反例：求解器模型中的赋值，以及到达失败点的块轨迹。
 */
@Getter
public final class Counterexample {

    private final String conditionName;
    private final Map<String, SolverValue> assignments;
    private final List<Integer> trace;

    public Counterexample(String conditionName, Map<String, SolverValue> assignments, List<Integer> trace) {
        this.conditionName = Objects.requireNonNull(conditionName, "Condition name cannot be null.");
        this.assignments = Collections.unmodifiableMap(new TreeMap<>(assignments));
        this.trace = List.copyOf(trace);
    }

    public Optional<SolverValue> valueOf(String name) {
        return Optional.ofNullable(assignments.get(name));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Counterexample for ").append(conditionName).append(": {");
        boolean first = true;
        for (Map.Entry<String, SolverValue> entry : assignments.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(" = ").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        if (!trace.isEmpty()) {
            sb.append(" via bb").append(trace);
        }
        return sb.toString();
    }
}

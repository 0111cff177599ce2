package org.aether.verification.mir;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

@Getter
public final class BasicBlock {

    private final int id;
    private final List<Statement> statements;
    private final Terminator terminator;

    public BasicBlock(int id, List<Statement> statements, Terminator terminator) {
        this.id = id;
        this.statements = List.copyOf(statements);
        this.terminator = Objects.requireNonNull(terminator, "Terminator cannot be null.");
    }

    @Override
    public String toString() {
        return "bb" + id + " " + statements + " " + terminator;
    }
}

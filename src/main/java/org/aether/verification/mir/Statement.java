package org.aether.verification.mir;

import lombok.Getter;
import org.aether.verification.core.SourceLocation;

import java.util.Objects;

@Getter
public final class Statement {

    public enum Kind {
        ASSIGN,
        STORAGE_LIVE,
        STORAGE_DEAD,
        NOP
    }

    public static final Statement NOP = new Statement(Kind.NOP, -1, null, SourceLocation.UNKNOWN);

    private final Kind kind;
    // ASSIGN 的目标，或 STORAGE_* 的局部变量
    private final int local;
    private final Rvalue rvalue;
    private final SourceLocation location;

    private Statement(Kind kind, int local, Rvalue rvalue, SourceLocation location) {
        this.kind = kind;
        this.local = local;
        this.rvalue = rvalue;
        this.location = location;
    }

    public static Statement assign(int local, Rvalue rvalue) {
        return assign(local, rvalue, SourceLocation.UNKNOWN);
    }

    public static Statement assign(int local, Rvalue rvalue, SourceLocation location) {
        return new Statement(Kind.ASSIGN, local, Objects.requireNonNull(rvalue, "Rvalue cannot be null."),
                Objects.requireNonNull(location, "Location cannot be null."));
    }

    public static Statement storageLive(int local) {
        return new Statement(Kind.STORAGE_LIVE, local, null, SourceLocation.UNKNOWN);
    }

    public static Statement storageDead(int local) {
        return new Statement(Kind.STORAGE_DEAD, local, null, SourceLocation.UNKNOWN);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ASSIGN:
                return "_" + local + " = " + rvalue;
            case STORAGE_LIVE:
                return "StorageLive(_" + local + ")";
            case STORAGE_DEAD:
                return "StorageDead(_" + local + ")";
            default:
                return "nop";
        }
    }
}

package org.aether.verification.mir;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class MirConstant {

    public enum Kind {
        INT,
        FLOAT,
        BOOL,
        CHAR,
        STRING,
        NULL
    }

    public static final MirConstant NULL = new MirConstant(Kind.NULL, null);

    private final Kind kind;
    // Long、Double、Boolean、Integer（码点）、String
    private final Object value;

    private MirConstant(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static MirConstant ofInt(long value) {
        return new MirConstant(Kind.INT, value);
    }

    public static MirConstant ofFloat(double value) {
        return new MirConstant(Kind.FLOAT, value);
    }

    public static MirConstant ofBool(boolean value) {
        return new MirConstant(Kind.BOOL, value);
    }

    public static MirConstant ofChar(int codePoint) {
        return new MirConstant(Kind.CHAR, codePoint);
    }

    public static MirConstant ofString(String value) {
        return new MirConstant(Kind.STRING, Objects.requireNonNull(value, "String constant cannot be null."));
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULL:
                return "null";
            case STRING:
                return "\"" + value + "\"";
            case CHAR:
                return "'" + new String(Character.toChars((Integer) value)) + "'";
            default:
                return String.valueOf(value);
        }
    }
}

package org.aether.verification.contract;

import lombok.Getter;

import java.util.Objects;

/**
 * 契约条件在运行时被违反时采取的动作。
 * THROW_EXCEPTION 与 RETURN_ERROR 带消息，CUSTOM_HANDLER 带处理器名称。
 */
@Getter
public final class FailureAction {

    public enum Kind {
        THROW_EXCEPTION,
        RETURN_ERROR,
        LOG_AND_CONTINUE,
        ABORT,
        CUSTOM_HANDLER
    }

    public static final FailureAction LOG_AND_CONTINUE = new FailureAction(Kind.LOG_AND_CONTINUE, null);
    public static final FailureAction ABORT = new FailureAction(Kind.ABORT, null);

    private final Kind kind;
    // 消息或处理器名称
    private final String argument;

    private FailureAction(Kind kind, String argument) {
        this.kind = kind;
        this.argument = argument;
    }

    public static FailureAction throwException(String message) {
        return new FailureAction(Kind.THROW_EXCEPTION, Objects.requireNonNull(message, "Message cannot be null."));
    }

    public static FailureAction returnError(String message) {
        return new FailureAction(Kind.RETURN_ERROR, Objects.requireNonNull(message, "Message cannot be null."));
    }

    public static FailureAction customHandler(String handler) {
        return new FailureAction(Kind.CUSTOM_HANDLER, Objects.requireNonNull(handler, "Handler cannot be null."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FailureAction that = (FailureAction) o;
        return kind == that.kind && Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argument);
    }

    @Override
    public String toString() {
        return argument == null ? kind.name() : kind.name() + "(" + argument + ")";
    }
}

package org.aether.verification.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 源代码位置，由前端在构建契约和 MIR 时附带。
 * 诊断层用它把验证结果映射回源码。
 * 此类是不可变的。
 */
@Getter
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    private final int hashCode;

    private SourceLocation(String file, int line, int column) {
        this.file = Objects.requireNonNull(file, "File cannot be null.");
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("行号和列号不能为负: " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
        this.hashCode = Objects.hash(file, line, column);
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    public boolean isUnknown() {
        return this == UNKNOWN || line == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isUnknown() ? file : file + ":" + line + ":" + column;
    }
}

package org.aether.verification.expressions;

public enum ConstantKind {
    INTEGER,
    FLOAT,
    BOOLEAN,
    STRING,
    NULL
}

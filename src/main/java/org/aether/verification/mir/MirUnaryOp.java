package org.aether.verification.mir;

public enum MirUnaryOp {
    NOT,
    NEG
}

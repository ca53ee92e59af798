package com.credit.modelengine.parity;

/** Outcome of the parity gate, ordered by severity. */
public enum GateVerdict {
    PASS,
    WARN,
    BLOCK
}

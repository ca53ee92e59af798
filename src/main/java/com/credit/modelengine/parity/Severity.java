package com.credit.modelengine.parity;

public enum Severity {
    WARNING,
    ERROR
}

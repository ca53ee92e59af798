package com.credit.modelengine.risk;

public enum RiskSeverity {
    LOW,
    MEDIUM,
    HIGH
}

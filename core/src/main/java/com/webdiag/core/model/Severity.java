package com.webdiag.core.model;

/** 이슈 심각도 (낮음 → 높음 순서) */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

package com.aceengine.core.event;

public enum EventType {
    PLAN_APPLIED,
    PLAN_SUGGESTED,
    PLAN_DENIED,
    PLAN_FAILED,
    REPAIR_PARTIAL,
    FILE_REVERTED,
    INTEGRITY_FAILURE
}

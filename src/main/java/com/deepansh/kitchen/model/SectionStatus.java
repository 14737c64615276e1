package com.deepansh.kitchen.model;

public enum SectionStatus {
    /** Agent succeeded; section holds its content. */
    COMPLETED,
    /** Agent ran and failed; section holds a degraded notice. */
    DEGRADED,
    /** Agent was required but never ran (deadline or cancellation). */
    SKIPPED
}

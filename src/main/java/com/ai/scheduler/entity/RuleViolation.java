package com.ai.scheduler.entity;

/**
 * Which opening-hours rule a requested interval breaks.
 */
public enum RuleViolation {
    OUTSIDE_HOURS,
    CROSSES_LUNCH,
    WEEKEND,
    HOLIDAY,
    STARTS_AFTER_LAST_SLOT
}

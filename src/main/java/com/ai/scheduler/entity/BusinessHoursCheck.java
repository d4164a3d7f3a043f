package com.ai.scheduler.entity;

public record BusinessHoursCheck(boolean valid, RuleViolation violation) {

    private static final BusinessHoursCheck OK = new BusinessHoursCheck(true, null);

    public static BusinessHoursCheck ok() {
        return OK;
    }

    public static BusinessHoursCheck invalid(RuleViolation violation) {
        return new BusinessHoursCheck(false, violation);
    }
}

package com.ai.scheduler.conversation;

public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}

package com.ai.scheduler.conversation;

public enum Intent {
    CREATE,
    RESCHEDULE,
    CANCEL,
    LIST,
    DATE_ONLY_CREATE,
    SLOT_CHOICE,
    CONFIRM_YES,
    CONFIRM_NO,
    GREETING,
    SMALLTALK,
    OUT_OF_SCOPE,
    UNKNOWN
}

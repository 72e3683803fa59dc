package com.ai.echomi.conversation;

public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}

package com.codeharness.core.events;

public enum ProgressSeverity {
    INFO,
    SUCCESS,
    ERROR
}

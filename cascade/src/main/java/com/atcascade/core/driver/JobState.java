package com.atcascade.core.driver;

public enum JobState {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }
}

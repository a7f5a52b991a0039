package com.gt.wordfilter.model;

public enum RemovalOutcome {
    REMOVED,
    NOT_FOUND
}

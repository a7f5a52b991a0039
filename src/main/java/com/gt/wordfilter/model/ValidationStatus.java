package com.gt.wordfilter.model;

public enum ValidationStatus {
    VALID,
    INVALID,        // the dictionary answered and the word is not in it, or has no definitions
    UNAVAILABLE     // the dictionary could not be asked (timeout, transport error, unexpected response)
}

package com.gt.wordfilter.validation;

public enum AcceptanceVerdict {
    ACCEPTED,
    REJECTED,
    UNVERIFIED  // the dictionary could not be reached, so nothing is known about the word
}

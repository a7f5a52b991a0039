package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a word fails the local format checks (letters only, minimum length)
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidWordException extends RuntimeException {

    public InvalidWordException(String errMsg) {
        super(errMsg);
    }

    public InvalidWordException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidPatternException extends RuntimeException {

    public InvalidPatternException(String errMsg) {
        super(errMsg);
    }

    public InvalidPatternException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

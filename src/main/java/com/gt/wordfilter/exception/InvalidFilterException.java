package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidFilterException extends RuntimeException {

    public InvalidFilterException(String errMsg) {
        super(errMsg);
    }

    public InvalidFilterException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

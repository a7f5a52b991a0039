package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class ExternalServiceUnavailableException extends RuntimeException {

    public ExternalServiceUnavailableException(String errMsg) {
        super(errMsg);
    }

    public ExternalServiceUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

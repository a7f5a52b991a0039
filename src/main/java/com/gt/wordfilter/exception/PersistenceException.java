package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a mutation could not be written to durable storage. The in-memory snapshot is left unchanged.
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class PersistenceException extends RuntimeException {

    public PersistenceException(String errMsg) {
        super(errMsg);
    }

    public PersistenceException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

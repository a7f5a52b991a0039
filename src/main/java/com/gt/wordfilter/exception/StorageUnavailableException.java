package com.gt.wordfilter.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the durable word storage cannot be read. Readers keep serving the last loaded snapshot.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String errMsg) {
        super(errMsg);
    }

    public StorageUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}

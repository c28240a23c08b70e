package org.kingstonaccess.service.exception;

/**
 * Base type for failures talking to a downstream HTTP service
 * (geocoding or language model).
 */
public abstract class ApiException extends RuntimeException {

    protected ApiException(String message) {
        super(message);
    }

    protected ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.kingstonaccess.service.exception;

/**
 * Transient downstream failure: 5xx, timeout, network error or an unreadable payload.
 */
public class RecoverableApiException extends ApiException {
    
    public RecoverableApiException(String message) {
        super(message);
    }
    
    public RecoverableApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

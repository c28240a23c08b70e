package org.kingstonaccess.service.exception;

/**
 * Downstream rejected the request (4xx) or answered with something unusable.
 * Not worth retrying.
 */
public class IrrecoverableApiException extends ApiException {
    
    public IrrecoverableApiException(String message) {
        super(message);
    }
    
    public IrrecoverableApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

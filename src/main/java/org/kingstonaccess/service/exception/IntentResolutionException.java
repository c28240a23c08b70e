package org.kingstonaccess.service.exception;

/**
 * Raised by the intent resolver when the language model could not be reached:
 * session setup failed or every send attempt was used up.
 */
public class IntentResolutionException extends RuntimeException {

    public IntentResolutionException(String message) {
        super(message);
    }

    public IntentResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

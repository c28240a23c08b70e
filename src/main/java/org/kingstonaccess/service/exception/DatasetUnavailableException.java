package org.kingstonaccess.service.exception;

public class DatasetUnavailableException extends RuntimeException {

    public DatasetUnavailableException(String message) {
        super(message);
    }
}

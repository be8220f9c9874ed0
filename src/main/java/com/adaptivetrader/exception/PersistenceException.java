package com.adaptivetrader.exception;

/**
 * Raised when the engine state file cannot be read or written.
 */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}

package com.mimecast.smime.exception;

/**
 * Base type for S/MIME certificate store and message protection failures.
 */
public class SmimeException extends RuntimeException {

    /**
     * Constructs a new SmimeException with a message.
     *
     * @param message Error message.
     */
    public SmimeException(String message) {
        super(message);
    }

    /**
     * Constructs a new SmimeException with a message and cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public SmimeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mimecast.smime.exception;

/**
 * Building the signed or enveloped MIME structure failed.
 */
public class SmimeProtectionException extends SmimeException {

    public SmimeProtectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

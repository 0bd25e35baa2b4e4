package com.mimecast.smime.exception;

/**
 * Private key material could not be decrypted or read.
 * <p>Messages never carry the secret.
 */
public class KeyDecryptionException extends SmimeException {

    public KeyDecryptionException(String message) {
        super(message);
    }

    public KeyDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mimecast.smime.exception;

/**
 * A certificate with the same fingerprint is already stored.
 */
public class DuplicateCertificateException extends SmimeException {

    private final String fingerprint;

    public DuplicateCertificateException(String fingerprint, Throwable cause) {
        super("Validation failed: fingerprint " + fingerprint + " has already been taken", cause);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}

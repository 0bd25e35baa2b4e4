package com.mimecast.smime.exception;

/**
 * No stored certificate matches the modulus of an imported private key.
 */
public class CertificateNotFoundException extends SmimeException {

    public CertificateNotFoundException(String message) {
        super(message);
    }
}

package com.mimecast.smime.exception;

/**
 * Input could not be decoded as an X.509 certificate.
 */
public class MalformedCertificateException extends SmimeException {

    public MalformedCertificateException(String message) {
        super(message);
    }

    public MalformedCertificateException(String message, Throwable cause) {
        super(message, cause);
    }
}

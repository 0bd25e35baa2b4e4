package com.mimecast.smime.exception;

/**
 * A resolved certificate is outside its validity window and expired use is not permitted.
 */
public class ExpiredCertificateException extends SmimeException {

    public ExpiredCertificateException(String message) {
        super(message);
    }
}

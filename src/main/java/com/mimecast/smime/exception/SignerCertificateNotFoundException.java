package com.mimecast.smime.exception;

/**
 * No certificate with a private key is usable for signing as the sender.
 */
public class SignerCertificateNotFoundException extends SmimeException {

    public SignerCertificateNotFoundException(String sender) {
        super("Unable to find ssl private key for '" + sender + "'");
    }
}

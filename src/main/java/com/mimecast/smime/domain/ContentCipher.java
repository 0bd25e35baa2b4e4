package com.mimecast.smime.domain;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.cms.CMSAlgorithm;

import java.util.Locale;

/**
 * Symmetric content encryption ciphers for enveloped data.
 */
public enum ContentCipher {
    AES_128_CBC("AES-128-CBC", CMSAlgorithm.AES128_CBC),
    AES_192_CBC("AES-192-CBC", CMSAlgorithm.AES192_CBC),
    AES_256_CBC("AES-256-CBC", CMSAlgorithm.AES256_CBC),
    DES_EDE3_CBC("DES-EDE3-CBC", CMSAlgorithm.DES_EDE3_CBC);

    private final String identifier;
    private final ASN1ObjectIdentifier algorithm;

    ContentCipher(String identifier, ASN1ObjectIdentifier algorithm) {
        this.identifier = identifier;
        this.algorithm = algorithm;
    }

    public String getIdentifier() {
        return identifier;
    }

    public ASN1ObjectIdentifier getAlgorithm() {
        return algorithm;
    }

    /**
     * Looks up a cipher by its OpenSSL style identifier, case-insensitive.
     *
     * @param identifier Identifier such as <code>AES-128-CBC</code>.
     * @return ContentCipher.
     * @throws IllegalArgumentException If the identifier is not recognised.
     */
    public static ContentCipher fromIdentifier(String identifier) {
        String wanted = identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
        for (ContentCipher cipher : values()) {
            if (cipher.identifier.equals(wanted)) {
                return cipher;
            }
        }
        throw new IllegalArgumentException("Unsupported cipher: " + identifier);
    }
}

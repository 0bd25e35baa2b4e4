package com.mimecast.smime.domain;

/**
 * X.509 keyUsage bits (RFC 5280 section 4.2.1.3).
 *
 * <p>Ordinals match the bit positions returned by
 * {@link java.security.cert.X509Certificate#getKeyUsage()}.
 */
public enum KeyUsageType {
    DIGITAL_SIGNATURE("Digital Signature"),
    NON_REPUDIATION("Non Repudiation"),
    KEY_ENCIPHERMENT("Key Encipherment"),
    DATA_ENCIPHERMENT("Data Encipherment"),
    KEY_AGREEMENT("Key Agreement"),
    KEY_CERT_SIGN("Certificate Sign"),
    CRL_SIGN("CRL Sign"),
    ENCIPHER_ONLY("Encipher Only"),
    DECIPHER_ONLY("Decipher Only");

    private final String displayName;

    KeyUsageType(String displayName) {
        this.displayName = displayName;
    }

    public int getBit() {
        return ordinal();
    }

    public String getDisplayName() {
        return displayName;
    }
}

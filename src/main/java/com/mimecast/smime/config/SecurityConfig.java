package com.mimecast.smime.config;

import com.mimecast.smime.domain.ContentCipher;

import java.util.Map;

/**
 * S/MIME security configuration.
 *
 * <p>Holds the expired certificate toggles for signing and encryption,
 * the symmetric content cipher and the chain length bound.
 */
public class SecurityConfig extends ConfigFoundation {

    /**
     * Constructs a new SecurityConfig instance.
     *
     * @param map Configuration map.
     */
    public SecurityConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if an expired certificate may be used for signing.
     *
     * @return Boolean (default: false).
     */
    public boolean isSignAllowExpired() {
        return getBooleanProperty("sign.allowExpired", false);
    }

    /**
     * Checks if expired recipient certificates may be used for encryption.
     *
     * @return Boolean (default: false).
     */
    public boolean isEncryptionAllowExpired() {
        return getBooleanProperty("encryption.allowExpired", false);
    }

    /**
     * Gets content encryption cipher.
     *
     * @return ContentCipher (default: AES-128-CBC).
     * @throws IllegalArgumentException If the configured identifier is unknown.
     */
    public ContentCipher getCipher() {
        return ContentCipher.fromIdentifier(getStringProperty("encryption.cipher", ContentCipher.AES_128_CBC.getIdentifier()));
    }

    /**
     * Gets maximum number of issuer certificates collected into a signature.
     *
     * @return Chain length bound (default: 10).
     */
    public int getMaxChainLength() {
        return Math.toIntExact(getLongProperty("maxChainLength", 10L));
    }
}

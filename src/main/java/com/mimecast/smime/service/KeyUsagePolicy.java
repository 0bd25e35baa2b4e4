package com.mimecast.smime.service;

import com.mimecast.smime.domain.KeyUsageType;
import com.mimecast.smime.domain.SmimeCertificate;

import java.security.cert.X509Certificate;

/**
 * Respects the keyUsage extension restriction, if present.
 *
 * <p>See RFC 5280 section 4.2.1.3. A certificate without the extension is not restricted.
 */
public class KeyUsagePolicy {

    /**
     * Checks if the keyUsage extension rules out the intended usage.
     *
     * @param certificate certificate record
     * @param usage       intended usage
     * @return true only when the extension is present and does not list the usage
     */
    public boolean prohibits(SmimeCertificate certificate, KeyUsageType usage) {
        return prohibits(certificate.getParsed(), usage);
    }

    /**
     * Checks if the keyUsage extension rules out the intended usage.
     *
     * @param certificate parsed certificate
     * @param usage       intended usage
     * @return true only when the extension is present and does not list the usage
     */
    public boolean prohibits(X509Certificate certificate, KeyUsageType usage) {
        boolean[] keyUsage = certificate.getKeyUsage();
        if (keyUsage == null) {
            return false;
        }
        return usage.getBit() >= keyUsage.length || !keyUsage[usage.getBit()];
    }
}

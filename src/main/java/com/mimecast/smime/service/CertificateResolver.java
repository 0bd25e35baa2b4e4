package com.mimecast.smime.service;

import com.mimecast.smime.domain.KeyUsageType;
import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.CertificatesNotFoundException;
import com.mimecast.smime.repository.SmimeCertificateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Selects the certificates to sign with and to encrypt to.
 *
 * <p>Both lookups walk the store newest first, so when an address has an old expired
 * certificate and a newer one, the newer one is found first and wins.
 * <br>Addresses are compared lower-cased.
 */
public class CertificateResolver {

    private static final Logger log = LogManager.getLogger(CertificateResolver.class);

    private final SmimeCertificateRepository repository;
    private final KeyUsagePolicy keyUsagePolicy;

    public CertificateResolver(SmimeCertificateRepository repository) {
        this(repository, new KeyUsagePolicy());
    }

    public CertificateResolver(SmimeCertificateRepository repository, KeyUsagePolicy keyUsagePolicy) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.keyUsagePolicy = Objects.requireNonNull(keyUsagePolicy, "keyUsagePolicy");
    }

    /**
     * Finds the certificate of the given sender address.
     *
     * <p>Only certificates with a private key and without a keyUsage restriction
     * against digital signatures are considered. The first match wins.
     *
     * @param address sender address
     * @return newest usable certificate, or empty
     */
    public Optional<SmimeCertificate> resolveSender(String address) {
        if (address == null) {
            return Optional.empty();
        }
        String lookup = normalize(address);

        for (SmimeCertificate certificate : repository.scan(true)) {
            if (keyUsagePolicy.prohibits(certificate, KeyUsageType.DIGITAL_SIGNATURE)) {
                continue;
            }
            if (certificate.getEmailAddresses().contains(lookup)) {
                log.debug("Resolved sender certificate id={} fingerprint={}", certificate.getId(), certificate.getFingerprint());
                return Optional.of(certificate);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds certificates covering all given recipient addresses.
     *
     * <p>A certificate is taken when it covers at least one still unresolved address and its
     * keyUsage does not rule out key encipherment. The scan stops once every address is covered.
     *
     * @param addresses recipient addresses, null entries are ignored
     * @return certificates in scan order
     * @throws CertificatesNotFoundException naming only the addresses left without a certificate
     */
    public List<SmimeCertificate> resolveRecipients(Collection<String> addresses) {
        Set<String> remaining = new LinkedHashSet<>();
        for (String address : addresses) {
            if (address != null) {
                remaining.add(normalize(address));
            }
        }

        List<SmimeCertificate> certificates = new ArrayList<>();
        if (remaining.isEmpty()) {
            return certificates;
        }

        for (SmimeCertificate certificate : repository.scan(false)) {
            Set<String> matched = new LinkedHashSet<>(certificate.getEmailAddresses());
            matched.retainAll(remaining);
            if (matched.isEmpty()) {
                continue;
            }
            if (keyUsagePolicy.prohibits(certificate, KeyUsageType.KEY_ENCIPHERMENT)) {
                continue;
            }

            certificates.add(certificate);
            remaining.removeAll(matched);

            if (remaining.isEmpty()) {
                break;
            }
        }

        if (!remaining.isEmpty()) {
            throw new CertificatesNotFoundException(new ArrayList<>(remaining));
        }
        return certificates;
    }

    private static String normalize(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}

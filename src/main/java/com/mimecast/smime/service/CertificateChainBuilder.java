package com.mimecast.smime.service;

import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.parser.CertificateParser;
import com.mimecast.smime.repository.SmimeCertificateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Collects stored issuer certificates for inclusion in a signature.
 *
 * <p>No trust validation is done. The walk follows issuer names through the store and stops at
 * a self-signed certificate, at a missing issuer, at a certificate already collected
 * or after {@code maxLength} certificates.
 */
public class CertificateChainBuilder {

    private static final Logger log = LogManager.getLogger(CertificateChainBuilder.class);

    private final SmimeCertificateRepository repository;
    private final int maxLength;

    public CertificateChainBuilder(SmimeCertificateRepository repository) {
        this(repository, 10);
    }

    public CertificateChainBuilder(SmimeCertificateRepository repository, int maxLength) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.maxLength = maxLength;
    }

    /**
     * Builds the issuer chain of a certificate, nearest issuer first.
     *
     * @param certificate leaf certificate
     * @return issuer certificates found, possibly empty or incomplete
     */
    public List<X509Certificate> build(SmimeCertificate certificate) {
        List<X509Certificate> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        String lookupIssuer = CertificateParser.issuer(certificate.getParsed());
        while (true) {
            Optional<SmimeCertificate> found = repository.findBySubject(lookupIssuer);
            if (found.isEmpty()) {
                break;
            }
            if (chain.size() >= maxLength) {
                log.warn("Issuer chain of certificate id={} truncated at {} certificates", certificate.getId(), maxLength);
                break;
            }

            SmimeCertificate issuer = found.get();
            if (!seen.add(issuer.getFingerprint())) {
                log.warn("Issuer cycle detected at certificate id={} fingerprint={}", issuer.getId(), issuer.getFingerprint());
                break;
            }

            X509Certificate parsed = issuer.getParsed();
            String subject = CertificateParser.subject(parsed);
            lookupIssuer = CertificateParser.issuer(parsed);
            chain.add(parsed);

            // Root CA reached.
            if (subject.equals(lookupIssuer)) {
                break;
            }
        }
        return chain;
    }
}

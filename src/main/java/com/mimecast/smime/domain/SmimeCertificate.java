package com.mimecast.smime.domain;

import com.mimecast.smime.parser.CertificateParser;
import com.mimecast.smime.parser.EmailAddressExtractor;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Represents an X.509 certificate stored in {@code smime_certificates}, optionally with its private key.
 *
 * <p>The parsed certificate and the subjectAltName email addresses are derived from {@code raw}
 * on first access and cached on this instance. Setting {@code raw} drops both caches.
 */
public class SmimeCertificate {

    private Long id;
    private String subject;
    private String subjectHash;
    private String fingerprint;
    private String modulus;
    private OffsetDateTime notBeforeAt;
    private OffsetDateTime notAfterAt;
    private String raw;
    private String privateKey;
    private String privateKeySecret;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    private X509Certificate parsed;
    private List<String> emailAddresses;

    /**
     * Returns the parsed certificate, decoding {@code raw} once.
     *
     * @return X509Certificate.
     */
    public X509Certificate getParsed() {
        if (parsed == null) {
            parsed = CertificateParser.parse(raw);
        }
        return parsed;
    }

    /**
     * Returns the lower-cased email addresses from the subjectAltName extension.
     *
     * @return Immutable list, empty when the extension is missing.
     */
    public List<String> getEmailAddresses() {
        if (emailAddresses == null) {
            emailAddresses = EmailAddressExtractor.extract(getParsed(), id);
        }
        return emailAddresses;
    }

    /**
     * Checks if the current time is outside the validity window.
     */
    public boolean isExpired() {
        return isExpired(Clock.systemUTC());
    }

    /**
     * Checks if the clock's current time is outside the validity window.
     */
    public boolean isExpired(Clock clock) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return now.isBefore(notBeforeAt) || now.isAfter(notAfterAt);
    }

    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getSubjectHash() {
        return subjectHash;
    }

    public void setSubjectHash(String subjectHash) {
        this.subjectHash = subjectHash;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getModulus() {
        return modulus;
    }

    public void setModulus(String modulus) {
        this.modulus = modulus;
    }

    public OffsetDateTime getNotBeforeAt() {
        return notBeforeAt;
    }

    public void setNotBeforeAt(OffsetDateTime notBeforeAt) {
        this.notBeforeAt = notBeforeAt;
    }

    public OffsetDateTime getNotAfterAt() {
        return notAfterAt;
    }

    public void setNotAfterAt(OffsetDateTime notAfterAt) {
        this.notAfterAt = notAfterAt;
    }

    public String getRaw() {
        return raw;
    }

    public void setRaw(String raw) {
        this.raw = raw;
        this.parsed = null;
        this.emailAddresses = null;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getPrivateKeySecret() {
        return privateKeySecret;
    }

    public void setPrivateKeySecret(String privateKeySecret) {
        this.privateKeySecret = privateKeySecret;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "SmimeCertificate{id=" + id + ", subject=" + subject + ", fingerprint=" + fingerprint + "}";
    }
}

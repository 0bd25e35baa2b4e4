package com.mimecast.smime.service;

import com.mimecast.smime.config.SecurityConfig;
import com.mimecast.smime.domain.ContentCipher;
import com.mimecast.smime.domain.OutgoingMail;
import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.ExpiredCertificateException;
import com.mimecast.smime.exception.SignerCertificateNotFoundException;
import com.mimecast.smime.exception.SmimeProtectionException;
import com.mimecast.smime.parser.PrivateKeyReader;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.smime.SMIMECapabilitiesAttribute;
import org.bouncycastle.asn1.smime.SMIMECapability;
import org.bouncycastle.asn1.smime.SMIMECapabilityVector;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoGeneratorBuilder;
import org.bouncycastle.cms.jcajce.JceCMSContentEncryptorBuilder;
import org.bouncycastle.cms.jcajce.JceKeyTransRecipientInfoGenerator;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.mail.smime.SMIMEEnvelopedGenerator;
import org.bouncycastle.mail.smime.SMIMEException;
import org.bouncycastle.mail.smime.SMIMESignedGenerator;
import org.bouncycastle.operator.OperatorCreationException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.PrivateKey;
import java.security.Security;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Signs and encrypts outgoing messages with S/MIME.
 *
 * <p>Signing produces a {@code multipart/signed} message with a detached PKCS#7 signature
 * ({@code SHA256withRSA}) that embeds the signer certificate and its stored issuer chain.
 * <br>Encryption produces an {@code application/pkcs7-mime} enveloped-data message addressed
 * to every resolved recipient certificate.
 *
 * <p>Each call is independent. Any failure is reported to the {@link SecureMailingLog}
 * and rethrown unchanged.
 */
public class SmimeOutgoingService {

    private static final Logger log = LogManager.getLogger(SmimeOutgoingService.class);

    private static final String BC_PROVIDER = "BC";
    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    static {
        if (Security.getProvider(BC_PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final CertificateResolver resolver;
    private final CertificateChainBuilder chainBuilder;
    private final PrivateKeyReader privateKeyReader;
    private final SecurityConfig security;
    private final SecureMailingLog mailingLog;
    private final Clock clock;
    private final Session session;

    public SmimeOutgoingService(CertificateResolver resolver, CertificateChainBuilder chainBuilder, SecurityConfig security) {
        this(resolver, chainBuilder, new PrivateKeyReader(), security, new Log4jSecureMailingLog(), Clock.systemUTC());
    }

    /**
     * Creates a SmimeOutgoingService.
     *
     * @param resolver         sender and recipient certificate lookup
     * @param chainBuilder     issuer chain lookup for signatures
     * @param privateKeyReader private key decryption
     * @param security         expired certificate toggles and content cipher
     * @param mailingLog       failure sink
     * @param clock            clock used for expiry checks
     */
    public SmimeOutgoingService(CertificateResolver resolver,
                                CertificateChainBuilder chainBuilder,
                                PrivateKeyReader privateKeyReader,
                                SecurityConfig security,
                                SecureMailingLog mailingLog,
                                Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.chainBuilder = Objects.requireNonNull(chainBuilder, "chainBuilder");
        this.privateKeyReader = Objects.requireNonNull(privateKeyReader, "privateKeyReader");
        this.security = Objects.requireNonNull(security, "security");
        this.mailingLog = Objects.requireNonNull(mailingLog, "mailingLog");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.session = Session.getInstance(new Properties());
    }

    /**
     * Signs the message content with the sender's certificate.
     *
     * @param mail outgoing message
     * @return encoded {@code multipart/signed} message
     * @throws SignerCertificateNotFoundException if the sender has no usable certificate
     * @throws ExpiredCertificateException        if the certificate is expired and that is not allowed
     * @throws com.mimecast.smime.exception.KeyDecryptionException if the private key cannot be decrypted
     * @throws SmimeProtectionException           if the signed structure cannot be built
     */
    public byte[] sign(OutgoingMail mail) {
        try {
            String from = mail.getFrom();
            SmimeCertificate certificate = resolver.resolveSender(from)
                    .orElseThrow(() -> new SignerCertificateNotFoundException(from));

            if (!security.isSignAllowExpired() && certificate.isExpired(clock)) {
                throw new ExpiredCertificateException("Expired certificate for " + from +
                        " (fingerprint " + certificate.getFingerprint() + ") with " +
                        certificate.getNotBeforeAt() + " to " + certificate.getNotAfterAt());
            }

            PrivateKey privateKey = privateKeyReader.read(certificate.getPrivateKey(), certificate.getPrivateKeySecret());
            List<X509Certificate> chain = chainBuilder.build(certificate);

            MimeMessage signed = createSigned(mail.getContent(), certificate.getParsed(), privateKey, chain);
            log.debug("Signed message with certificate id={} chain={}", certificate.getId(), chain.size());
            return toBytes(signed);
        } catch (RuntimeException e) {
            mailingLog.log("sign", "failed", e.getMessage());
            throw e;
        }
    }

    /**
     * Encrypts the message content to the certificates of all To and Cc recipients.
     *
     * @param mail outgoing message
     * @return encoded {@code application/pkcs7-mime} message
     * @throws com.mimecast.smime.exception.CertificatesNotFoundException if a recipient has no usable certificate
     * @throws ExpiredCertificateException if a certificate is expired and that is not allowed
     * @throws SmimeProtectionException    if the enveloped structure cannot be built
     */
    public byte[] encrypt(OutgoingMail mail) {
        try {
            List<SmimeCertificate> certificates = recipientCertificates(mail);
            if (certificates.isEmpty()) {
                throw new IllegalArgumentException("No recipients to encrypt for");
            }

            if (!security.isEncryptionAllowExpired()) {
                Optional<SmimeCertificate> expired = certificates.stream()
                        .filter(c -> c.isExpired(clock))
                        .findFirst();
                if (expired.isPresent()) {
                    throw new ExpiredCertificateException("Expired certificates for cert with " +
                            expired.get().getNotBeforeAt() + " to " + expired.get().getNotAfterAt());
                }
            }

            MimeMessage encrypted = createEnveloped(mail.getContent(), certificates, security.getCipher());
            log.debug("Encrypted message for {} certificate(s)", certificates.size());
            return toBytes(encrypted);
        } catch (RuntimeException e) {
            mailingLog.log("encryption", "failed", e.getMessage());
            throw e;
        }
    }

    /**
     * Resolves To and Cc independently and concatenates the results.
     */
    private List<SmimeCertificate> recipientCertificates(OutgoingMail mail) {
        List<SmimeCertificate> certificates = new ArrayList<>();
        for (List<String> addresses : List.of(mail.getTo(), mail.getCc())) {
            if (!addresses.isEmpty()) {
                certificates.addAll(resolver.resolveRecipients(addresses));
            }
        }
        return certificates;
    }

    private MimeMessage createSigned(byte[] content, X509Certificate signer, PrivateKey privateKey, List<X509Certificate> chain) {
        try {
            List<X509Certificate> certificates = new ArrayList<>();
            certificates.add(signer);
            for (X509Certificate issuer : chain) {
                if (!certificates.contains(issuer)) {
                    certificates.add(issuer);
                }
            }

            SMIMESignedGenerator generator = new SMIMESignedGenerator();
            generator.addSignerInfoGenerator(new JcaSimpleSignerInfoGeneratorBuilder()
                    .setProvider(BC_PROVIDER)
                    .setSignedAttributeGenerator(new AttributeTable(capabilities()))
                    .build(SIGNATURE_ALGORITHM, privateKey, signer));
            generator.addCertificates(new JcaCertStore(certificates));

            MimeMultipart multipart = generator.generate(new MimeBodyPart(new ByteArrayInputStream(content)));

            MimeMessage message = new MimeMessage(session);
            message.setContent(multipart, multipart.getContentType());
            message.saveChanges();
            return message;
        } catch (MessagingException | SMIMEException | OperatorCreationException | CertificateEncodingException e) {
            throw new SmimeProtectionException("Unable to sign message: " + e.getMessage(), e);
        }
    }

    private MimeMessage createEnveloped(byte[] content, List<SmimeCertificate> recipients, ContentCipher cipher) {
        try {
            SMIMEEnvelopedGenerator generator = new SMIMEEnvelopedGenerator();
            for (SmimeCertificate recipient : recipients) {
                generator.addRecipientInfoGenerator(new JceKeyTransRecipientInfoGenerator(recipient.getParsed())
                        .setProvider(BC_PROVIDER));
            }

            MimeBodyPart enveloped = generator.generate(
                    new MimeBodyPart(new ByteArrayInputStream(content)),
                    new JceCMSContentEncryptorBuilder(cipher.getAlgorithm())
                            .setProvider(BC_PROVIDER)
                            .build());

            MimeMessage message = new MimeMessage(session);
            message.setContent(enveloped.getContent(), enveloped.getContentType());
            message.saveChanges();
            return message;
        } catch (MessagingException | SMIMEException | CMSException | CertificateEncodingException | IOException e) {
            throw new SmimeProtectionException("Unable to encrypt message: " + e.getMessage(), e);
        }
    }

    /**
     * Advertises the content ciphers this sender can decrypt.
     */
    private static ASN1EncodableVector capabilities() {
        SMIMECapabilityVector capabilities = new SMIMECapabilityVector();
        capabilities.addCapability(SMIMECapability.aES256_CBC);
        capabilities.addCapability(SMIMECapability.aES192_CBC);
        capabilities.addCapability(SMIMECapability.aES128_CBC);
        capabilities.addCapability(SMIMECapability.dES_EDE3_CBC);

        ASN1EncodableVector attributes = new ASN1EncodableVector();
        attributes.add(new SMIMECapabilitiesAttribute(capabilities));
        return attributes;
    }

    private static byte[] toBytes(MimeMessage message) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            return out.toByteArray();
        } catch (IOException | MessagingException e) {
            throw new SmimeProtectionException("Unable to encode protected message: " + e.getMessage(), e);
        }
    }
}

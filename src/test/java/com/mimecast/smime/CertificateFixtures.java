package com.mimecast.smime;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.openssl.jcajce.JcePEMEncryptorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.StringWriter;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Mints RSA keys and X.509 certificates for tests.
 */
public final class CertificateFixtures {

    private static final String BC_PROVIDER = "BC";
    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        if (Security.getProvider(BC_PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private CertificateFixtures() {
    }

    public static KeyPair keyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA", BC_PROVIDER);
            generator.initialize(2048, RANDOM);
            return generator.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to generate RSA key pair", e);
        }
    }

    /**
     * Starts a certificate for the given subject, valid from yesterday for a year, self-signed.
     */
    public static Builder certificate(String subject) {
        return new Builder(subject);
    }

    public static String pem(X509Certificate certificate) {
        return write(certificate);
    }

    public static String encryptedKeyPem(PrivateKey key, String secret) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(key, new JcePEMEncryptorBuilder("AES-128-CBC")
                    .setProvider(BC_PROVIDER)
                    .build(secret.toCharArray()));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to write encrypted key", e);
        }
        return out.toString();
    }

    public static String pkcs8KeyPem(PrivateKey key) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(new JcaPKCS8Generator(key, null).generate());
        } catch (Exception e) {
            throw new IllegalStateException("Unable to write PKCS#8 key", e);
        }
        return out.toString();
    }

    private static String write(Object object) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to write PEM", e);
        }
        return out.toString();
    }

    /**
     * Certificate under construction.
     */
    public static final class Builder {
        private final String subject;
        private String issuer;
        private PrivateKey issuerKey;
        private KeyPair keyPair;
        private Instant notBefore = Instant.now().minus(Duration.ofDays(1));
        private Instant notAfter = Instant.now().plus(Duration.ofDays(365));
        private final List<GeneralName> altNames = new ArrayList<>();
        private Integer keyUsage;
        private boolean ca;

        private Builder(String subject) {
            this.subject = subject;
        }

        public Builder emails(String... addresses) {
            for (String address : addresses) {
                altNames.add(new GeneralName(GeneralName.rfc822Name, address));
            }
            return this;
        }

        public Builder dnsName(String name) {
            altNames.add(new GeneralName(GeneralName.dNSName, name));
            return this;
        }

        /**
         * Sets keyUsage bits, e.g. {@code KeyUsage.digitalSignature | KeyUsage.keyEncipherment}.
         */
        public Builder keyUsage(int bits) {
            this.keyUsage = bits;
            return this;
        }

        public Builder validity(Instant notBefore, Instant notAfter) {
            this.notBefore = notBefore;
            this.notAfter = notAfter;
            return this;
        }

        public Builder issuedBy(String issuer, PrivateKey issuerKey) {
            this.issuer = issuer;
            this.issuerKey = issuerKey;
            return this;
        }

        public Builder keyPair(KeyPair keyPair) {
            this.keyPair = keyPair;
            return this;
        }

        public Builder ca() {
            this.ca = true;
            return this;
        }

        public Issued issue() {
            KeyPair subjectKeys = keyPair != null ? keyPair : CertificateFixtures.keyPair();
            String issuerName = issuer != null ? issuer : subject;
            PrivateKey signingKey = issuerKey != null ? issuerKey : subjectKeys.getPrivate();

            try {
                X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                        new X500Name(issuerName),
                        new BigInteger(64, RANDOM),
                        Date.from(notBefore),
                        Date.from(notAfter),
                        new X500Name(subject),
                        subjectKeys.getPublic());

                if (!altNames.isEmpty()) {
                    builder.addExtension(Extension.subjectAlternativeName, false,
                            new GeneralNames(altNames.toArray(new GeneralName[0])));
                }
                if (keyUsage != null) {
                    builder.addExtension(Extension.keyUsage, true, new KeyUsage(keyUsage));
                }
                if (ca) {
                    builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
                }

                ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA")
                        .setProvider(BC_PROVIDER)
                        .build(signingKey);
                X509Certificate certificate = new JcaX509CertificateConverter()
                        .setProvider(BC_PROVIDER)
                        .getCertificate(builder.build(signer));
                return new Issued(certificate, subjectKeys);
            } catch (Exception e) {
                throw new IllegalStateException("Unable to issue test certificate", e);
            }
        }
    }

    /**
     * Issued certificate and its key pair.
     */
    public record Issued(X509Certificate certificate, KeyPair keyPair) {

        public String pem() {
            return CertificateFixtures.pem(certificate);
        }

        public PrivateKey privateKey() {
            return keyPair.getPrivate();
        }
    }
}

package com.mimecast.smime.parser;

import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.MalformedCertificateException;
import org.apache.commons.codec.digest.DigestUtils;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1ParsingException;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.x509.Certificate;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decodes PEM certificates and derives the identity fields stored for them.
 */
public final class CertificateParser {

    private static final String BC_PROVIDER = "BC";

    /**
     * OpenSSL writes trust settings as <code>TRUSTED CERTIFICATE</code>, the DER prefix is a plain certificate.
     */
    private static final Pattern TRUSTED_MARKER = Pattern.compile("(?:TRUSTED\\s)?(CERTIFICATE---)");

    static {
        if (Security.getProvider(BC_PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private CertificateParser() {
        // static utility
    }

    /**
     * Parses a single PEM certificate.
     *
     * @param pem PEM text.
     * @return X509Certificate.
     * @throws MalformedCertificateException If the text does not hold a decodable certificate.
     */
    public static X509Certificate parse(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new MalformedCertificateException("No certificate data given");
        }

        String normalized = TRUSTED_MARKER.matcher(pem).replaceAll("$1");
        try (PemReader reader = new PemReader(new StringReader(normalized))) {
            PemObject object = reader.readPemObject();
            if (object == null) {
                throw new MalformedCertificateException("No PEM block found");
            }

            // Reads the leading certificate and ignores trailing trust data.
            ASN1Primitive primitive;
            try (ASN1InputStream asn1 = new ASN1InputStream(object.getContent())) {
                primitive = asn1.readObject();
            }
            if (primitive == null) {
                throw new MalformedCertificateException("Empty certificate block");
            }

            X509CertificateHolder holder = new X509CertificateHolder(Certificate.getInstance(primitive));
            return new JcaX509CertificateConverter()
                    .setProvider(BC_PROVIDER)
                    .getCertificate(holder);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException
                 | DecoderException | ASN1ParsingException e) {
            throw new MalformedCertificateException("Unable to parse certificate: " + e.getMessage(), e);
        }
    }

    /**
     * Builds an unsaved record with all identity fields derived from the PEM text.
     *
     * @param pem PEM text.
     * @return SmimeCertificate without id.
     * @throws MalformedCertificateException If the text does not hold a decodable certificate.
     */
    public static SmimeCertificate toRecord(String pem) {
        X509Certificate cert = parse(pem);

        SmimeCertificate record = new SmimeCertificate();
        record.setSubject(subject(cert));
        record.setSubjectHash(DigestUtils.sha1Hex(cert.getSubjectX500Principal().getEncoded()));
        record.setFingerprint(fingerprint(cert));
        record.setModulus(modulus(cert));
        record.setNotBeforeAt(cert.getNotBefore().toInstant().atOffset(ZoneOffset.UTC));
        record.setNotAfterAt(cert.getNotAfter().toInstant().atOffset(ZoneOffset.UTC));
        record.setRaw(toPem(cert));
        return record;
    }

    /**
     * Gets the subject distinguished name in RFC 2253 form.
     */
    public static String subject(X509Certificate cert) {
        return cert.getSubjectX500Principal().getName();
    }

    /**
     * Gets the issuer distinguished name in RFC 2253 form.
     */
    public static String issuer(X509Certificate cert) {
        return cert.getIssuerX500Principal().getName();
    }

    /**
     * Gets the lowercase hex SHA-1 digest of the DER encoding.
     *
     * @param cert Certificate.
     * @return Fingerprint.
     */
    public static String fingerprint(X509Certificate cert) {
        try {
            return DigestUtils.sha1Hex(cert.getEncoded());
        } catch (CertificateEncodingException e) {
            throw new MalformedCertificateException("Unable to encode certificate", e);
        }
    }

    /**
     * Gets the uppercase hex RSA modulus of the public key.
     *
     * @param cert Certificate.
     * @return Modulus or null for non-RSA keys.
     */
    public static String modulus(X509Certificate cert) {
        if (cert.getPublicKey() instanceof RSAPublicKey rsa) {
            return rsa.getModulus().toString(16).toUpperCase(Locale.ROOT);
        }
        return null;
    }

    /**
     * Re-encodes a certificate as PEM.
     *
     * @param cert Certificate.
     * @return PEM text.
     */
    public static String toPem(X509Certificate cert) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject("CERTIFICATE", cert.getEncoded()));
        } catch (IOException | CertificateEncodingException e) {
            throw new MalformedCertificateException("Unable to encode certificate", e);
        }
        return out.toString();
    }
}

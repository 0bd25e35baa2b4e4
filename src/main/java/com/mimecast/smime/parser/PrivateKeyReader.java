package com.mimecast.smime.parser;

import com.mimecast.smime.exception.KeyDecryptionException;
import org.bouncycastle.asn1.ASN1ParsingException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.util.encoders.DecoderException;

import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.Security;
import java.security.interfaces.RSAKey;
import java.util.Locale;

/**
 * Reads PEM private keys, decrypting them with a secret where needed.
 *
 * <p>Supported blocks:
 * <ul>
 *   <li>Legacy OpenSSL encrypted keys ({@code Proc-Type: 4,ENCRYPTED}).</li>
 *   <li>PKCS#8 {@code ENCRYPTED PRIVATE KEY}.</li>
 *   <li>Unencrypted {@code RSA PRIVATE KEY} and {@code PRIVATE KEY}, where the secret is ignored.</li>
 * </ul>
 */
public class PrivateKeyReader {

    private static final String BC_PROVIDER = "BC";

    static {
        if (Security.getProvider(BC_PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    /**
     * Reads a private key.
     *
     * @param pem    PEM text.
     * @param secret Decryption secret, may be null.
     * @return PrivateKey.
     * @throws KeyDecryptionException Wrong secret, corrupt or unsupported key material.
     */
    public PrivateKey read(String pem, String secret) {
        char[] password = secret != null ? secret.toCharArray() : new char[0];
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(BC_PROVIDER);

        try (PEMParser parser = new PEMParser(new StringReader(pem == null ? "" : pem))) {
            Object object = parser.readObject();

            if (object instanceof PEMEncryptedKeyPair encrypted) {
                PEMKeyPair keyPair = encrypted.decryptKeyPair(new JcePEMDecryptorProviderBuilder()
                        .setProvider(BC_PROVIDER)
                        .build(password));
                return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            }
            if (object instanceof PKCS8EncryptedPrivateKeyInfo encrypted) {
                InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                        .setProvider(BC_PROVIDER)
                        .build(password);
                return converter.getPrivateKey(encrypted.decryptPrivateKeyInfo(decryptor));
            }
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            }
            if (object instanceof PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
        } catch (IOException | OperatorCreationException | PKCSException | IllegalArgumentException
                 | DecoderException | ASN1ParsingException e) {
            throw new KeyDecryptionException("Unable to decrypt private key: " + e.getMessage(), e);
        }

        throw new KeyDecryptionException("No private key found in PEM data");
    }

    /**
     * Gets the uppercase hex RSA modulus of a private key.
     *
     * @param key Private key.
     * @return Modulus.
     * @throws KeyDecryptionException If the key is not an RSA key.
     */
    public String modulus(PrivateKey key) {
        if (key instanceof RSAKey rsa) {
            return rsa.getModulus().toString(16).toUpperCase(Locale.ROOT);
        }
        throw new KeyDecryptionException("Unsupported private key algorithm: " + key.getAlgorithm());
    }
}

package com.mimecast.smime.service;

import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.CertificateNotFoundException;
import com.mimecast.smime.parser.CertificateParser;
import com.mimecast.smime.parser.PemBlocks;
import com.mimecast.smime.parser.PrivateKeyReader;
import com.mimecast.smime.repository.SmimeCertificateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Imports certificates and private keys from arbitrary text holding PEM blocks.
 *
 * <p>Blocks are processed in order and failures are raised for the block at hand.
 * Blocks before a failing one stay imported.
 */
public class CertificateImportService {

    private static final Logger log = LogManager.getLogger(CertificateImportService.class);

    private final SmimeCertificateRepository repository;
    private final PrivateKeyReader privateKeyReader;

    public CertificateImportService(SmimeCertificateRepository repository) {
        this(repository, new PrivateKeyReader());
    }

    public CertificateImportService(SmimeCertificateRepository repository, PrivateKeyReader privateKeyReader) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.privateKeyReader = Objects.requireNonNull(privateKeyReader, "privateKeyReader");
    }

    /**
     * Stores every certificate block found in the text.
     *
     * @param raw text holding PEM blocks
     * @return created records, in input order
     * @throws com.mimecast.smime.exception.MalformedCertificateException  if a block cannot be decoded
     * @throws com.mimecast.smime.exception.DuplicateCertificateException if a certificate is already stored
     */
    public List<SmimeCertificate> importCertificates(String raw) {
        List<SmimeCertificate> created = new ArrayList<>();
        for (String block : PemBlocks.extract(raw, "CERTIFICATE")) {
            SmimeCertificate certificate = repository.insert(CertificateParser.toRecord(block));
            log.info("Imported certificate id={} subject={} fingerprint={}",
                    certificate.getId(), certificate.getSubject(), certificate.getFingerprint());
            created.add(certificate);
        }
        return created;
    }

    /**
     * Attaches every private key block found in the text to the stored certificate with the same modulus.
     *
     * @param raw    text holding PEM blocks
     * @param secret secret to decrypt the keys with
     * @throws CertificateNotFoundException if no certificate matches a key
     * @throws com.mimecast.smime.exception.KeyDecryptionException if a key cannot be decrypted
     */
    public void importPrivateKeys(String raw, String secret) {
        for (String block : PemBlocks.extract(raw, "PRIVATE KEY")) {
            PrivateKey privateKey = privateKeyReader.read(block, secret);
            String modulus = privateKeyReader.modulus(privateKey);

            SmimeCertificate certificate = repository.findByModulus(modulus)
                    .orElseThrow(() -> new CertificateNotFoundException("The certificate for this private key could not be found."));

            repository.attachPrivateKey(certificate.getId(), block, secret);
            certificate.setPrivateKey(block);
            certificate.setPrivateKeySecret(secret);
            log.info("Attached private key to certificate id={} fingerprint={}", certificate.getId(), certificate.getFingerprint());
        }
    }
}

package com.mimecast.smime.service;

import com.mimecast.smime.CertificateFixtures;
import com.mimecast.smime.DatabaseFixtures;
import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.parser.CertificateParser;
import com.mimecast.smime.repository.SmimeCertificateRepository;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CertificateChainBuilder} against an H2 backed repository.
 */
class CertificateChainBuilderTest {

    private static HikariDataSource ds;
    private static SmimeCertificateRepository repo;

    private static CertificateFixtures.Issued root;
    private static CertificateFixtures.Issued intermediate;
    private static CertificateFixtures.Issued leaf;

    @BeforeAll
    static void setUp() {
        ds = DatabaseFixtures.create("smime_chain_test");
        repo = new SmimeCertificateRepository(ds);

        root = CertificateFixtures.certificate("CN=Test Root CA,O=Example").ca().issue();
        intermediate = CertificateFixtures.certificate("CN=Test Intermediate CA,O=Example").ca()
                .issuedBy("CN=Test Root CA,O=Example", root.privateKey())
                .issue();
        leaf = CertificateFixtures.certificate("CN=Alice").emails("alice@example.com")
                .issuedBy("CN=Test Intermediate CA,O=Example", intermediate.privateKey())
                .issue();
    }

    @AfterAll
    static void tearDown() {
        if (ds != null) ds.close();
    }

    @BeforeEach
    void clean() throws SQLException {
        DatabaseFixtures.clear(ds);
    }

    @Test
    void buildsFullChainNearestIssuerFirst() {
        store(root);
        store(intermediate);
        SmimeCertificate alice = store(leaf);

        List<X509Certificate> chain = new CertificateChainBuilder(repo).build(alice);

        assertEquals(List.of(intermediate.certificate(), root.certificate()), chain);
    }

    @Test
    void incompleteChainStopsAtFirstMissingIssuer() {
        store(intermediate);
        SmimeCertificate alice = store(leaf);

        assertEquals(List.of(intermediate.certificate()), new CertificateChainBuilder(repo).build(alice));
    }

    @Test
    void noStoredIssuerYieldsEmptyChain() {
        SmimeCertificate alice = store(leaf);

        assertTrue(new CertificateChainBuilder(repo).build(alice).isEmpty());
    }

    @Test
    void selfSignedCertificateIsItsOwnChain() {
        SmimeCertificate self = store(CertificateFixtures.certificate("CN=Self").emails("self@example.com").issue());

        List<X509Certificate> chain = new CertificateChainBuilder(repo).build(self);

        assertEquals(1, chain.size());
        assertEquals(self.getFingerprint(), CertificateParser.fingerprint(chain.get(0)));
    }

    @Test
    void issuerCycleTerminates() {
        KeyPair keysA = CertificateFixtures.keyPair();
        KeyPair keysB = CertificateFixtures.keyPair();
        SmimeCertificate a = store(CertificateFixtures.certificate("CN=Cycle A").keyPair(keysA)
                .issuedBy("CN=Cycle B", keysB.getPrivate()).issue());
        SmimeCertificate b = store(CertificateFixtures.certificate("CN=Cycle B").keyPair(keysB)
                .issuedBy("CN=Cycle A", keysA.getPrivate()).issue());

        List<X509Certificate> chain = new CertificateChainBuilder(repo).build(a);

        assertEquals(List.of(b.getFingerprint(), a.getFingerprint()), fingerprints(chain));
    }

    @Test
    void chainIsBoundedByMaxLength() {
        store(root);
        store(intermediate);
        SmimeCertificate alice = store(leaf);

        List<X509Certificate> chain = new CertificateChainBuilder(repo, 1).build(alice);

        assertEquals(List.of(intermediate.certificate()), chain);
    }

    // --- helpers ---

    private static SmimeCertificate store(CertificateFixtures.Issued issued) {
        return repo.insert(CertificateParser.toRecord(issued.pem()));
    }

    private static List<String> fingerprints(List<X509Certificate> chain) {
        List<String> list = new ArrayList<>();
        for (X509Certificate cert : chain) {
            list.add(CertificateParser.fingerprint(cert));
        }
        return list;
    }
}

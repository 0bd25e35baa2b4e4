package com.mimecast.smime.parser;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Extracts email addresses from the subjectAltName extension.
 */
public final class EmailAddressExtractor {
    private static final Logger log = LogManager.getLogger(EmailAddressExtractor.class);

    /**
     * GeneralName tag for rfc822Name.
     */
    private static final int RFC822_NAME = 1;

    private EmailAddressExtractor() {
        // static utility
    }

    /**
     * Extracts lower-cased rfc822Name entries, dropping malformed addresses.
     *
     * @param cert Certificate.
     * @param id   Record id for log messages, may be null.
     * @return Immutable list of addresses.
     */
    public static List<String> extract(X509Certificate cert, Long id) {
        Collection<List<?>> names;
        try {
            names = cert.getSubjectAlternativeNames();
        } catch (CertificateParsingException e) {
            log.warn("SmimeCertificate with ID {} has an unreadable subjectAltName extension: {}", id, e.getMessage());
            return List.of();
        }

        if (names == null) {
            log.warn("SmimeCertificate with ID {} has no subjectAltName extension and therefore no email addresses assigned. " +
                    "This makes it useless in terms of S/MIME. Please check.", id);
            return List.of();
        }

        List<String> addresses = new ArrayList<>();
        for (List<?> name : names) {
            if (name.size() < 2 || !(name.get(0) instanceof Integer tag) || tag != RFC822_NAME) {
                continue;
            }

            String address = String.valueOf(name.get(1)).trim().toLowerCase(Locale.ROOT);
            if (!isValid(address)) {
                log.warn("SmimeCertificate with ID {} has the malformed email address \"{}\" stored in the subjectAltName extension. " +
                        "This makes it useless in terms of S/MIME. Please check.", id, address);
                continue;
            }
            addresses.add(address);
        }
        return List.copyOf(addresses);
    }

    private static boolean isValid(String address) {
        if (address.isEmpty() || !address.contains("@")) {
            return false;
        }
        try {
            new InternetAddress(address, true).validate();
            return true;
        } catch (AddressException e) {
            return false;
        }
    }
}

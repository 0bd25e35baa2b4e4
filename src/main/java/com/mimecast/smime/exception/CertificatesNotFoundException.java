package com.mimecast.smime.exception;

import java.util.List;

/**
 * One or more recipients have no usable encryption certificate.
 *
 * <p>Carries exactly the unresolved addresses. Addresses that were satisfied
 * during resolution are never part of the message or the address list.
 */
public class CertificatesNotFoundException extends SmimeException {

    private final List<String> addresses;

    /**
     * Constructs a new CertificatesNotFoundException.
     *
     * @param addresses Unresolved, lower-cased addresses.
     */
    public CertificatesNotFoundException(List<String> addresses) {
        super("Can't find S/MIME encryption certificates for: " + String.join(", ", addresses));
        this.addresses = List.copyOf(addresses);
    }

    /**
     * Gets the unresolved addresses.
     *
     * @return Immutable list of addresses.
     */
    public List<String> getAddresses() {
        return addresses;
    }
}

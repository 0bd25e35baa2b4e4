package com.mimecast.smime.service;

/**
 * Sink for secure mailing outcomes.
 */
@FunctionalInterface
public interface SecureMailingLog {

    /**
     * Records an outcome.
     *
     * @param operation operation name, e.g. {@code sign} or {@code encryption}
     * @param outcome   outcome, e.g. {@code failed}
     * @param message   detail message, never containing key material
     */
    void log(String operation, String outcome, String message);
}

package com.mimecast.smime.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes secure mailing outcomes to Log4j2.
 * <p>Failures are logged at ERROR, everything else at INFO.
 */
public class Log4jSecureMailingLog implements SecureMailingLog {

    private static final Logger log = LogManager.getLogger(Log4jSecureMailingLog.class);

    @Override
    public void log(String operation, String outcome, String message) {
        if ("failed".equals(outcome)) {
            log.error("type=S/MIME operation={} outcome={} {}", operation, outcome, message);
        } else {
            log.info("type=S/MIME operation={} outcome={} {}", operation, outcome, message);
        }
    }
}

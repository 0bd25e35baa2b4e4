/**
 * PEM and X.509 parsing.
 *
 * <p>Turns raw text into PEM blocks, certificates into stored identity fields
 * (subject, fingerprint, modulus, validity window) and encrypted PEM keys into private keys.
 * <br>Decoding is done with Bouncy Castle.
 */
package com.mimecast.smime.parser;

/**
 * Failure types raised while importing certificates, resolving them and protecting outgoing mail.
 *
 * <p>All types are unchecked and extend {@link com.mimecast.smime.exception.SmimeException}.
 */
package com.mimecast.smime.exception;

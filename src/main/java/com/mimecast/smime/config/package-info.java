/**
 * Configuration of the S/MIME certificate store and message protection.
 *
 * <p>Configuration lives in a JSON5 file, by default <code>smime.json5</code> on the classpath.
 * <br>The CLI accepts <code>--config</code> or a system property called <i>smime.config</i> to override it.
 *
 * <p>Sections:
 * <ul>
 *   <li><b>store</b>: JDBC URL, credentials, pool size and scan batch size.</li>
 *   <li><b>security</b>: expired certificate toggles for <code>sign</code> and <code>encryption</code>,
 *   the content cipher and the issuer chain bound.</li>
 * </ul>
 */
package com.mimecast.smime.config;

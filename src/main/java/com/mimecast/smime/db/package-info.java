/**
 * Database plumbing: the shared HikariCP pool and the bundled schema.
 */
package com.mimecast.smime.db;

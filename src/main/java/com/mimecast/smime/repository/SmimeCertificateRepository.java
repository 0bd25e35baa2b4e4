package com.mimecast.smime.repository;

import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.DuplicateCertificateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * JDBC DAO for {@code smime_certificates}.
 *
 * <p>Every multi-row read uses the default order: validity end descending,
 * then validity start descending, then id descending.
 */
public class SmimeCertificateRepository {

    private static final Logger log = LogManager.getLogger(SmimeCertificateRepository.class);

    /**
     * SQLState for unique constraint violations (PostgreSQL and H2).
     */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String DEFAULT_ORDER =
            " ORDER BY not_after_at DESC, not_before_at DESC, id DESC";

    private static final String INSERT =
            "INSERT INTO smime_certificates " +
            "(subject, subject_hash, fingerprint, modulus, not_before_at, not_after_at, raw, private_key, private_key_secret) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_BY_ID =
            "SELECT * FROM smime_certificates WHERE id = ?";

    private static final String SELECT_BY_FINGERPRINT =
            "SELECT * FROM smime_certificates WHERE fingerprint = ?";

    private static final String SELECT_BY_MODULUS =
            "SELECT * FROM smime_certificates WHERE modulus = ?" + DEFAULT_ORDER + " LIMIT 1";

    private static final String SELECT_BY_SUBJECT =
            "SELECT * FROM smime_certificates WHERE subject = ?" + DEFAULT_ORDER + " LIMIT 1";

    private static final String UPDATE_PRIVATE_KEY =
            "UPDATE smime_certificates SET private_key = ?, private_key_secret = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?";

    private static final String DELETE_BY_ID =
            "DELETE FROM smime_certificates WHERE id = ?";

    private static final String COUNT =
            "SELECT COUNT(*) FROM smime_certificates";

    private static final String PRIVATE_KEY_PRESENT = "private_key IS NOT NULL";

    /**
     * Keyset condition: rows strictly after the last row of the previous page in default order.
     */
    private static final String AFTER_CURSOR =
            "(not_after_at < ? OR (not_after_at = ? AND (not_before_at < ? OR (not_before_at = ? AND id < ?))))";

    private final DataSource dataSource;
    private final int batchSize;

    public SmimeCertificateRepository(DataSource dataSource) {
        this(dataSource, 100);
    }

    /**
     * Creates a SmimeCertificateRepository.
     *
     * @param dataSource DataSource instance.
     * @param batchSize  Rows read per page by {@link #scan(boolean)}.
     */
    public SmimeCertificateRepository(DataSource dataSource, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.dataSource = dataSource;
        this.batchSize = batchSize;
    }

    /**
     * Inserts a new certificate and populates its {@code id}.
     *
     * <p>Fingerprint uniqueness is enforced by the table constraint, so concurrent
     * imports of the same certificate cannot both succeed.
     *
     * @param certificate certificate to persist
     * @return the same instance
     * @throws DuplicateCertificateException if the fingerprint is already stored
     */
    public SmimeCertificate insert(SmimeCertificate certificate) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, certificate.getSubject());
            ps.setString(2, certificate.getSubjectHash());
            ps.setString(3, certificate.getFingerprint());
            ps.setString(4, certificate.getModulus());
            setTimestamp(ps, 5, certificate.getNotBeforeAt());
            setTimestamp(ps, 6, certificate.getNotAfterAt());
            ps.setString(7, certificate.getRaw());
            ps.setString(8, certificate.getPrivateKey());
            ps.setString(9, certificate.getPrivateKeySecret());
            ps.executeUpdate();

            try (ResultSet generated = ps.getGeneratedKeys()) {
                if (generated.next()) {
                    certificate.setId(generated.getLong(1));
                }
            }
            return certificate;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                log.warn("Rejected duplicate certificate fingerprint={}", certificate.getFingerprint());
                throw new DuplicateCertificateException(certificate.getFingerprint(), e);
            }
            log.error("insert SmimeCertificate(fingerprint={}) failed: {}", certificate.getFingerprint(), e.getMessage());
            throw new IllegalStateException("Failed to insert S/MIME certificate", e);
        }
    }

    /**
     * Returns a certificate by primary key.
     */
    public Optional<SmimeCertificate> findById(long id) {
        return findOne(SELECT_BY_ID, ps -> ps.setLong(1, id), "findById(" + id + ")");
    }

    /**
     * Returns the certificate with the given fingerprint.
     */
    public Optional<SmimeCertificate> findByFingerprint(String fingerprint) {
        return findOne(SELECT_BY_FINGERPRINT, ps -> ps.setString(1, fingerprint), "findByFingerprint(" + fingerprint + ")");
    }

    /**
     * Returns the newest certificate whose public key has the given modulus.
     */
    public Optional<SmimeCertificate> findByModulus(String modulus) {
        return findOne(SELECT_BY_MODULUS, ps -> ps.setString(1, modulus), "findByModulus");
    }

    /**
     * Returns the newest certificate with the given subject distinguished name.
     */
    public Optional<SmimeCertificate> findBySubject(String subject) {
        return findOne(SELECT_BY_SUBJECT, ps -> ps.setString(1, subject), "findBySubject(" + subject + ")");
    }

    /**
     * Stores a private key and its secret on an existing certificate.
     *
     * @param id         certificate id
     * @param privateKey PEM private key
     * @param secret     decryption secret, may be null
     */
    public void attachPrivateKey(long id, String privateKey, String secret) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_PRIVATE_KEY)) {
            ps.setString(1, privateKey);
            ps.setString(2, secret);
            ps.setLong(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("attachPrivateKey(id={}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to attach private key", e);
        }
    }

    /**
     * Deletes a certificate.
     *
     * @return true if a row was removed
     */
    public boolean deleteById(long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(DELETE_BY_ID)) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("deleteById({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to delete S/MIME certificate", e);
        }
    }

    /**
     * Returns the number of stored certificates.
     */
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            log.error("count() failed: {}", e.getMessage());
            throw new IllegalStateException("Failed to count S/MIME certificates", e);
        }
    }

    /**
     * Returns a lazy view over all certificates in default order.
     *
     * <p>Rows are read in pages of {@code batchSize} using the last seen row as cursor,
     * so the table is never materialized at once. Each iteration starts a fresh scan.
     *
     * @param privateKeyOnly restrict to certificates carrying a private key
     * @return Iterable of certificates
     */
    public Iterable<SmimeCertificate> scan(boolean privateKeyOnly) {
        return () -> new PagedIterator(privateKeyOnly);
    }

    /**
     * Reads one page after the given cursor.
     *
     * @param privateKeyOnly restrict to certificates carrying a private key
     * @param cursor         last row of the previous page, or null for the first page
     * @return up to {@code batchSize} certificates
     */
    List<SmimeCertificate> findPage(boolean privateKeyOnly, SmimeCertificate cursor) {
        List<String> conditions = new ArrayList<>();
        if (privateKeyOnly) {
            conditions.add(PRIVATE_KEY_PRESENT);
        }
        if (cursor != null) {
            conditions.add(AFTER_CURSOR);
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM smime_certificates");
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(DEFAULT_ORDER).append(" LIMIT ?");

        List<SmimeCertificate> page = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            if (cursor != null) {
                setTimestamp(ps, idx++, cursor.getNotAfterAt());
                setTimestamp(ps, idx++, cursor.getNotAfterAt());
                setTimestamp(ps, idx++, cursor.getNotBeforeAt());
                setTimestamp(ps, idx++, cursor.getNotBeforeAt());
                ps.setLong(idx++, cursor.getId());
            }
            ps.setInt(idx, batchSize);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    page.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("findPage(privateKeyOnly={}) failed: {}", privateKeyOnly, e.getMessage());
            throw new IllegalStateException("Failed to scan S/MIME certificates", e);
        }
        return page;
    }

    // --- private helpers ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private Optional<SmimeCertificate> findOne(String sql, Binder binder, String description) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("{} failed: {}", description, e.getMessage());
            throw new IllegalStateException("Failed to find S/MIME certificate", e);
        }
    }

    private SmimeCertificate map(ResultSet rs) throws SQLException {
        SmimeCertificate certificate = new SmimeCertificate();
        certificate.setId(rs.getLong("id"));
        certificate.setSubject(rs.getString("subject"));
        certificate.setSubjectHash(rs.getString("subject_hash"));
        certificate.setFingerprint(rs.getString("fingerprint"));
        certificate.setModulus(rs.getString("modulus"));
        certificate.setNotBeforeAt(toOffsetDateTime(rs.getTimestamp("not_before_at")));
        certificate.setNotAfterAt(toOffsetDateTime(rs.getTimestamp("not_after_at")));
        certificate.setRaw(rs.getString("raw"));
        certificate.setPrivateKey(rs.getString("private_key"));
        certificate.setPrivateKeySecret(rs.getString("private_key_secret"));
        certificate.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        certificate.setUpdatedAt(toOffsetDateTime(rs.getTimestamp("updated_at")));
        return certificate;
    }

    private void setTimestamp(PreparedStatement ps, int idx, OffsetDateTime dt) throws SQLException {
        if (dt == null) {
            ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(idx, dt);
        }
    }

    private OffsetDateTime toOffsetDateTime(Timestamp ts) {
        return ts == null ? null : ts.toInstant().atOffset(ZoneOffset.UTC);
    }

    /**
     * Iterates page by page, fetching the next page only when the current one is used up.
     */
    private class PagedIterator implements Iterator<SmimeCertificate> {
        private final boolean privateKeyOnly;
        private List<SmimeCertificate> page = List.of();
        private int position;
        private SmimeCertificate cursor;
        private boolean exhausted;

        PagedIterator(boolean privateKeyOnly) {
            this.privateKeyOnly = privateKeyOnly;
        }

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }

            page = findPage(privateKeyOnly, cursor);
            position = 0;
            if (page.size() < batchSize) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1);
            }
            return !page.isEmpty();
        }

        @Override
        public SmimeCertificate next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(position++);
        }
    }
}

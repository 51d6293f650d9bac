package com.acme.voice.persistence.jdbc.ledger;

import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.repository.ActionLedgerRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Abstract JDBC implementation of the action ledger using the template method pattern.
 * Subclasses provide the dialect's insert-if-absent statement.
 */
public abstract class JdbcActionLedgerRepository implements ActionLedgerRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcActionLedgerRepository.class);

    private static final String FIND_RESULT_SQL = """
            SELECT result_json FROM action_ledger WHERE idempotency_key = ?
            """;

    protected final DataSource dataSource;

    protected JdbcActionLedgerRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findResult(String idempotencyKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_RESULT_SQL)) {

            ps.setString(1, idempotencyKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "read action ledger", LOG);
        }
    }

    @Override
    @Transactional
    public boolean recordIfAbsent(String idempotencyKey, long recordId, String actionType, String resultJson) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertIfAbsentSql())) {

            ps.setString(1, idempotencyKey);
            ps.setLong(2, recordId);
            ps.setString(3, actionType);
            ps.setString(4, resultJson);
            ps.setTimestamp(5, Timestamp.from(Instant.now()));
            bindGuard(ps, idempotencyKey);

            boolean inserted = ps.executeUpdate() > 0;
            if (inserted) {
                LOG.debug("Recorded action {} under key {}", actionType, idempotencyKey);
            } else {
                LOG.debug("Action ledger already holds key {}", idempotencyKey);
            }
            return inserted;

        } catch (SQLException e) {
            if (isDuplicateKey(e)) {
                LOG.debug("Concurrent insert of ledger key {}", idempotencyKey);
                return false;
            }
            throw ExceptionTranslator.translateException(e, "record action ledger entry", LOG);
        }
    }

    /** Binds parameters after the first five, for statements that repeat the key in a guard clause. */
    protected void bindGuard(PreparedStatement ps, String idempotencyKey) throws SQLException {
    }

    protected abstract String getInsertIfAbsentSql();

    private static boolean isDuplicateKey(SQLException e) {
        return "23505".equals(e.getSQLState());
    }
}

package com.acme.voice.persistence.jdbc.dlq;

import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.repository.DeadLetterRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Parks failed envelopes in {@code command_dlq}. Subclasses supply the dialect's insert statement.
 */
public abstract class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDeadLetterRepository.class);

    protected final DataSource dataSource;

    protected JdbcDeadLetterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void park(
            long recordId,
            String tenantId,
            String userId,
            String payload,
            String errorClass,
            String errorMessage,
            int attempts,
            String parkedBy) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setLong(1, recordId);
            ps.setString(2, tenantId);
            ps.setString(3, userId);
            ps.setString(4, payload);
            ps.setString(5, errorClass);
            ps.setString(6, errorMessage);
            ps.setInt(7, attempts);
            ps.setString(8, parkedBy);
            ps.setTimestamp(9, Timestamp.from(Instant.now()));
            ps.executeUpdate();

            LOG.debug("Parked command record {} (attempts={}, parkedBy={})", recordId, attempts, parkedBy);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "park command record " + recordId, LOG);
        }
    }

    /** Insert with nine parameters in the order of {@link #park}, followed by the parked-at time. */
    protected abstract String getInsertSql();
}

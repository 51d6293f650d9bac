package com.acme.voice.persistence.jdbc;

import com.acme.voice.core.PermanentException;
import com.acme.voice.domain.CommandRecord;
import com.acme.voice.domain.ProcessingStatus;
import com.acme.voice.repository.CommandRecordRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
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
 * JDBC access to {@code command_record}. Every write stamps {@code updated_at} and commits
 * before returning, so each status change is visible before the next stage starts.
 */
@Singleton
public class JdbcCommandRecordRepository implements CommandRecordRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcCommandRecordRepository.class);

    private static final String FIND_BY_ID_SQL = """
            SELECT id, tenant_id, user_id, house_id, node_id, audio_url, input_text, response_text,
                   status, created_at, updated_at
            FROM command_record
            WHERE id = ?
            """;

    private static final String UPDATE_STATUS_SQL = """
            UPDATE command_record
            SET status = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String UPDATE_INPUT_TEXT_SQL = """
            UPDATE command_record
            SET input_text = ?, status = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String UPDATE_RESPONSE_SQL = """
            UPDATE command_record
            SET response_text = ?, status = ?, updated_at = ?
            WHERE id = ?
            """;

    private final DataSource dataSource;

    public JdbcCommandRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CommandRecord> findById(long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_ID_SQL)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find command record " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void transition(long id, ProcessingStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_STATUS_SQL)) {

            ps.setString(1, status.value());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setLong(3, id);
            requireUpdated(ps.executeUpdate(), id);
            LOG.debug("Command record {} -> {}", id, status.value());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update status of command record " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void recordInputText(long id, String inputText, ProcessingStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_INPUT_TEXT_SQL)) {

            ps.setString(1, inputText);
            ps.setString(2, status.value());
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setLong(4, id);
            requireUpdated(ps.executeUpdate(), id);
            LOG.debug("Command record {} -> {} with input text", id, status.value());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "store input text of command record " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void recordResponse(long id, String responseText, ProcessingStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_RESPONSE_SQL)) {

            ps.setString(1, responseText);
            ps.setString(2, status.value());
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setLong(4, id);
            requireUpdated(ps.executeUpdate(), id);
            LOG.debug("Command record {} -> {} with response", id, status.value());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "store response of command record " + id, LOG);
        }
    }

    private static void requireUpdated(int rows, long id) {
        if (rows == 0) {
            throw new PermanentException("Command record not found: " + id);
        }
    }

    private static CommandRecord mapRow(ResultSet rs) throws SQLException {
        CommandRecord record = new CommandRecord();
        record.setId(rs.getLong("id"));
        record.setTenantId(rs.getString("tenant_id"));
        record.setUserId(rs.getString("user_id"));
        record.setHouseId(JdbcColumns.nullableLong(rs, "house_id"));
        record.setNodeId(JdbcColumns.nullableLong(rs, "node_id"));
        record.setAudioUrl(rs.getString("audio_url"));
        record.setInputText(rs.getString("input_text"));
        record.setResponseText(rs.getString("response_text"));
        record.setStatus(ProcessingStatus.fromValue(rs.getString("status")));
        record.setCreatedAt(JdbcColumns.instant(rs, "created_at"));
        record.setUpdatedAt(JdbcColumns.instant(rs, "updated_at"));
        return record;
    }
}

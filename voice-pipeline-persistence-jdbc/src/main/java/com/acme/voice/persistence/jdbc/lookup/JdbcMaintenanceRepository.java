package com.acme.voice.persistence.jdbc.lookup;

import com.acme.voice.domain.MaintenanceRecord;
import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.persistence.jdbc.JdbcColumns;
import com.acme.voice.repository.MaintenanceRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Singleton
public class JdbcMaintenanceRepository implements MaintenanceRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMaintenanceRepository.class);

    private static final String FIND_BY_USER_SQL = """
            SELECT id, tenant_id, user_id, house_id, description, status, created_at
            FROM maintenance_record
            WHERE user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private static final String COUNT_PENDING_SQL = """
            SELECT COUNT(*) FROM maintenance_record WHERE house_id = ? AND status = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO maintenance_record (tenant_id, user_id, house_id, description, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;

    public JdbcMaintenanceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MaintenanceRecord> findByUser(String userId, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_USER_SQL)) {

            ps.setString(1, userId);
            ps.setInt(2, limit);
            List<MaintenanceRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new MaintenanceRecord(
                            rs.getLong("id"),
                            rs.getString("tenant_id"),
                            rs.getString("user_id"),
                            JdbcColumns.nullableLong(rs, "house_id"),
                            rs.getString("description"),
                            rs.getString("status"),
                            JdbcColumns.instant(rs, "created_at")));
                }
            }
            return records;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list maintenance records", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public int countPendingByHouse(long houseId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_PENDING_SQL)) {

            ps.setLong(1, houseId);
            ps.setString(2, MaintenanceRecord.STATUS_PENDING);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count pending maintenance", LOG);
        }
    }

    @Override
    @Transactional
    public long create(MaintenanceRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, record.tenantId());
            ps.setString(2, record.userId());
            if (record.houseId() == null) {
                ps.setNull(3, Types.BIGINT);
            } else {
                ps.setLong(3, record.houseId());
            }
            ps.setString(4, record.description());
            ps.setString(5, record.status());
            ps.setTimestamp(6, Timestamp.from(record.createdAt() != null ? record.createdAt() : Instant.now()));
            ps.executeUpdate();

            long id = GeneratedKeys.first(ps);
            LOG.info("Created maintenance request {} for house {}", id, record.houseId());
            return id;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create maintenance request", LOG);
        }
    }
}

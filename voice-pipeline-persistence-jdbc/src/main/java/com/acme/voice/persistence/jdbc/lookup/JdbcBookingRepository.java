package com.acme.voice.persistence.jdbc.lookup;

import com.acme.voice.domain.BookingSummary;
import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.persistence.jdbc.JdbcColumns;
import com.acme.voice.repository.BookingRepository;
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
public class JdbcBookingRepository implements BookingRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcBookingRepository.class);

    private static final String FIND_BY_USER_SQL = """
            SELECT id, tenant_id, user_id, house_id, room_name, status, created_at
            FROM booking
            WHERE user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO booking (tenant_id, user_id, house_id, room_name, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;

    public JdbcBookingRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<BookingSummary> findByUser(String userId, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_USER_SQL)) {

            ps.setString(1, userId);
            ps.setInt(2, limit);
            List<BookingSummary> bookings = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bookings.add(new BookingSummary(
                            rs.getLong("id"),
                            rs.getString("tenant_id"),
                            rs.getString("user_id"),
                            JdbcColumns.nullableLong(rs, "house_id"),
                            rs.getString("room_name"),
                            rs.getString("status"),
                            JdbcColumns.instant(rs, "created_at")));
                }
            }
            return bookings;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list bookings", LOG);
        }
    }

    @Override
    @Transactional
    public long createRequest(BookingSummary booking) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, booking.tenantId());
            ps.setString(2, booking.userId());
            if (booking.houseId() == null) {
                ps.setNull(3, Types.BIGINT);
            } else {
                ps.setLong(3, booking.houseId());
            }
            ps.setString(4, booking.roomName());
            ps.setString(5, BookingSummary.STATUS_REQUESTED);
            ps.setTimestamp(6, Timestamp.from(booking.createdAt() != null ? booking.createdAt() : Instant.now()));
            ps.executeUpdate();

            long id = GeneratedKeys.first(ps);
            LOG.info("Created booking request {} for house {}", id, booking.houseId());
            return id;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create booking request", LOG);
        }
    }
}

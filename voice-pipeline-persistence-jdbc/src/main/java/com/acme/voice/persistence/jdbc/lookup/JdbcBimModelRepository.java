package com.acme.voice.persistence.jdbc.lookup;

import com.acme.voice.domain.BimModel;
import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.repository.BimModelRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class JdbcBimModelRepository implements BimModelRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcBimModelRepository.class);

    private static final String FIND_BY_STATUS_SQL = """
            SELECT id, user_id, name, conversion_status
            FROM bim_model
            WHERE user_id = ? AND conversion_status = ?
            ORDER BY id
            """;

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT conversion_status, COUNT(*) AS models
            FROM bim_model
            WHERE user_id = ?
            GROUP BY conversion_status
            ORDER BY conversion_status
            """;

    private final DataSource dataSource;

    public JdbcBimModelRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<BimModel> findPendingByUser(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_STATUS_SQL)) {

            ps.setString(1, userId);
            ps.setString(2, BimModel.STATUS_PENDING);
            List<BimModel> models = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    models.add(new BimModel(
                            rs.getLong("id"),
                            rs.getString("user_id"),
                            rs.getString("name"),
                            rs.getString("conversion_status")));
                }
            }
            return models;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find pending BIM models", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Integer> countByStatus(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_BY_STATUS_SQL)) {

            ps.setString(1, userId);
            Map<String, Integer> counts = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(rs.getString("conversion_status"), rs.getInt("models"));
                }
            }
            return counts;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count BIM models by status", LOG);
        }
    }
}

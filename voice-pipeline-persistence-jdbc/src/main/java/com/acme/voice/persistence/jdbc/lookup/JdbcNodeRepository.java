package com.acme.voice.persistence.jdbc.lookup;

import com.acme.voice.domain.IotNode;
import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.repository.NodeRepository;
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
import java.util.List;

@Singleton
public class JdbcNodeRepository implements NodeRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcNodeRepository.class);

    private static final String FIND_BY_HOUSE_AND_USER_SQL = """
            SELECT id, house_id, name, node_type, active
            FROM iot_node
            WHERE house_id = ? AND user_id = ?
            ORDER BY id
            """;

    private static final String COUNT_ACTIVE_SQL = """
            SELECT COUNT(*) FROM iot_node WHERE house_id = ? AND active = TRUE
            """;

    private final DataSource dataSource;

    public JdbcNodeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<IotNode> findByHouseAndUser(long houseId, String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_HOUSE_AND_USER_SQL)) {

            ps.setLong(1, houseId);
            ps.setString(2, userId);
            List<IotNode> nodes = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    nodes.add(new IotNode(
                            rs.getLong("id"),
                            rs.getLong("house_id"),
                            rs.getString("name"),
                            rs.getString("node_type"),
                            rs.getBoolean("active")));
                }
            }
            return nodes;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find nodes of house " + houseId, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public int countActiveByHouse(long houseId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_ACTIVE_SQL)) {

            ps.setLong(1, houseId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count active nodes of house " + houseId, LOG);
        }
    }
}

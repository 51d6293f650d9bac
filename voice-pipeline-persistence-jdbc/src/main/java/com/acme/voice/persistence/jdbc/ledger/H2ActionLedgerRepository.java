package com.acme.voice.persistence.jdbc.ledger;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2ActionLedgerRepository extends JdbcActionLedgerRepository {

    public H2ActionLedgerRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertIfAbsentSql() {
        return """
                INSERT INTO action_ledger (idempotency_key, record_id, action_type, result_json, created_at)
                SELECT ?, ?, ?, ?, ?
                WHERE NOT EXISTS(SELECT 1 FROM action_ledger WHERE idempotency_key = ?)
                """;
    }

    @Override
    protected void bindGuard(PreparedStatement ps, String idempotencyKey) throws SQLException {
        ps.setString(6, idempotencyKey);
    }
}

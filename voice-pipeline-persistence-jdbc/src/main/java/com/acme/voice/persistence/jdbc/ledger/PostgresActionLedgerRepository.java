package com.acme.voice.persistence.jdbc.ledger;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresActionLedgerRepository extends JdbcActionLedgerRepository {

    public PostgresActionLedgerRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertIfAbsentSql() {
        return """
                INSERT INTO action_ledger (idempotency_key, record_id, action_type, result_json, created_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (idempotency_key) DO NOTHING
                """;
    }
}

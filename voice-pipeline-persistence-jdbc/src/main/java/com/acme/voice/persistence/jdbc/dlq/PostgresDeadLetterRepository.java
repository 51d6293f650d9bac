package com.acme.voice.persistence.jdbc.dlq;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** Stores the envelope as {@code jsonb} so parked commands can be queried by field. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDeadLetterRepository extends JdbcDeadLetterRepository {

    public PostgresDeadLetterRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO command_dlq
                (record_id, tenant_id, user_id, payload, error_class, error_message, attempts, parked_by, parked_at)
                VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
                """;
    }
}

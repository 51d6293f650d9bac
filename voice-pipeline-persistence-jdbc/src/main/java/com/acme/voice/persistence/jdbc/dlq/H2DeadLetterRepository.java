package com.acme.voice.persistence.jdbc.dlq;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DeadLetterRepository extends JdbcDeadLetterRepository {

    public H2DeadLetterRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO command_dlq
                (record_id, tenant_id, user_id, payload, error_class, error_message, attempts, parked_by, parked_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }
}

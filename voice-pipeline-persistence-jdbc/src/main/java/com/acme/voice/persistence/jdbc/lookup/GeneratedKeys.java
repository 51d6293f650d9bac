package com.acme.voice.persistence.jdbc.lookup;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

final class GeneratedKeys {

    private GeneratedKeys() {
    }

    static long first(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned", "22000");
            }
            return keys.getLong(1);
        }
    }
}

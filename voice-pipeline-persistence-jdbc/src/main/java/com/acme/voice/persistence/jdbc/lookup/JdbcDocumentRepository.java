package com.acme.voice.persistence.jdbc.lookup;

import com.acme.voice.domain.DocumentSummary;
import com.acme.voice.persistence.jdbc.ExceptionTranslator;
import com.acme.voice.persistence.jdbc.JdbcColumns;
import com.acme.voice.repository.DocumentRepository;
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
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/** Reads the document titles a user owns, newest first. */
@Singleton
public class JdbcDocumentRepository implements DocumentRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDocumentRepository.class);

    private static final String FIND_BY_OWNER_SQL = """
            SELECT id, title, file_type, created_at
            FROM document
            WHERE owner_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private static final String SEARCH_PREFIX_SQL = """
            SELECT id, title, file_type, created_at
            FROM document
            WHERE owner_id = ? AND (
            """;

    private static final String SEARCH_SUFFIX_SQL = """
            )
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private final DataSource dataSource;

    public JdbcDocumentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentSummary> findByUser(String userId, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FIND_BY_OWNER_SQL)) {

            ps.setString(1, userId);
            ps.setInt(2, limit);
            return readAll(ps);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list documents", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentSummary> searchByUser(String userId, List<String> terms, int limit) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        String sql = SEARCH_PREFIX_SQL
                + String.join(" OR ", Collections.nCopies(terms.size(), "LOWER(title) LIKE ?"))
                + SEARCH_SUFFIX_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            ps.setString(index++, userId);
            for (String term : terms) {
                ps.setString(index++, "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%");
            }
            ps.setInt(index, limit);
            return readAll(ps);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "search documents", LOG);
        }
    }

    private static List<DocumentSummary> readAll(PreparedStatement ps) throws SQLException {
        List<DocumentSummary> documents = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                documents.add(new DocumentSummary(
                        rs.getLong("id"),
                        rs.getString("title"),
                        rs.getString("file_type"),
                        JdbcColumns.instant(rs, "created_at")));
            }
        }
        return documents;
    }

    // backslash is the default LIKE escape in both H2 and PostgreSQL
    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}

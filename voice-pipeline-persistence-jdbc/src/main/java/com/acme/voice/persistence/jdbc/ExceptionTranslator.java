package com.acme.voice.persistence.jdbc;

import com.acme.voice.core.PermanentException;
import com.acme.voice.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates {@link SQLException}s into the pipeline's retry classification.
 * A {@link TransientException} makes the retry controller run the command again,
 * a {@link PermanentException} parks it at once. Unknown failures count as transient.
 */
public final class ExceptionTranslator {

    /** 08 connection exception, 40 transaction rollback. */
    private static final List<String> TRANSIENT_STATE_CLASSES = List.of("08", "40");

    /** 22 data, 23 integrity, 42 syntax or access, 3D catalog, 3F schema. */
    private static final List<String> PERMANENT_STATE_CLASSES = List.of("22", "23", "42", "3D", "3F");

    private static final List<String> TRANSIENT_MESSAGES = List.of(
            "timeout", "connection refused", "connection reset", "deadlock",
            "too many connections", "pool exhausted");

    private static final List<String> PERMANENT_MESSAGES = List.of(
            "syntax error", "table not found", "column not found", "does not exist",
            "schema not found", "database not found", "constraint violation",
            "unique constraint", "foreign key", "type mismatch", "invalid column", "value too long");

    /** PostgreSQL serialization/connection failures, H2 general timeout. */
    private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(40001, 8003, 8006, 90008);

    /** PostgreSQL undefined column and key violations, H2 missing table/column and parameter count. */
    private static final Set<Integer> PERMANENT_VENDOR_CODES = Set.of(42703, 23505, 23503, 42102, 42122, 90007);

    /** 57P03: server is starting up or in recovery. */
    private static final String CANNOT_CONNECT_NOW = "57P03";

    private ExceptionTranslator() {
    }

    /**
     * @param exception the driver failure
     * @param operation what the repository was doing, used in the message
     * @param logger    the calling repository's logger
     * @return the exception to throw, carrying the original as its cause
     */
    public static RuntimeException translateException(SQLException exception, String operation, Logger logger) {
        logger.error("Database operation failed: {}", operation, exception);

        if (isTransient(exception)) {
            return new TransientException(
                    "Transient database error during " + operation + ": " + exception.getMessage(), exception);
        }
        if (isPermanent(exception)) {
            return new PermanentException(
                    "Permanent database error during " + operation + ": " + exception.getMessage(), exception);
        }
        return new TransientException(
                "Database error during " + operation + ": " + exception.getMessage(), exception);
    }

    static boolean isTransient(SQLException exception) {
        String state = exception.getSQLState();
        if (state != null && (CANNOT_CONNECT_NOW.equals(state) || hasStateClass(state, TRANSIENT_STATE_CLASSES))) {
            return true;
        }
        return mentions(exception, TRANSIENT_MESSAGES)
                || TRANSIENT_VENDOR_CODES.contains(exception.getErrorCode());
    }

    static boolean isPermanent(SQLException exception) {
        String state = exception.getSQLState();
        if (state != null && hasStateClass(state, PERMANENT_STATE_CLASSES)) {
            return true;
        }
        return mentions(exception, PERMANENT_MESSAGES)
                || PERMANENT_VENDOR_CODES.contains(exception.getErrorCode());
    }

    private static boolean hasStateClass(String state, List<String> classes) {
        for (String prefix : classes) {
            if (state.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentions(SQLException exception, List<String> fragments) {
        if (exception.getMessage() == null) {
            return false;
        }
        String message = exception.getMessage().toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (message.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}

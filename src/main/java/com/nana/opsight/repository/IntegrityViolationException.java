package com.nana.opsight.repository;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Locale;

/**
 * A write was rejected by a store constraint: primary key, unique, foreign
 * key, NOT NULL or CHECK.
 *
 * <p>During a load this aborts the current chunk and stops the run.
 */
public class IntegrityViolationException extends RepositoryException {

    /** SQLite primary result code for constraint failures. */
    private static final int SQLITE_CONSTRAINT = 19;

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Decides whether a JDBC failure was a constraint violation.
     *
     * <p>The xerial driver reports constraint failures with the SQLite result
     * code (possibly extended) and, for batches, only through the message of
     * a {@link java.sql.BatchUpdateException}; so the SQLState, the error
     * code and the message are all checked, along the cause and
     * next-exception chains.
     *
     * @param ex the exception to classify; may be null
     * @return true if any exception in the chain is a constraint failure
     */
    public static boolean isConstraintViolation(SQLException ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (current instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith("23")) {
                    return true;
                }
                if ((sql.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
                    return true;
                }
                if (sql.getNextException() != null
                        && isConstraintViolation(sql.getNextException())) {
                    return true;
                }
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("sqlite_constraint") || lower.contains("constraint failed")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}

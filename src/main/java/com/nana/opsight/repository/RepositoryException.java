package com.nana.opsight.repository;

/**
 * Unchecked exception thrown by every repository when a database operation
 * fails.
 *
 * <p>Repositories catch each {@link java.sql.SQLException} and rethrow it
 * wrapped in this type (or in {@link IntegrityViolationException} for
 * constraint failures), so callers never deal with JDBC exceptions. Callers
 * that can act on the failure catch it; the rest let it reach the
 * transaction boundary, which rolls back.
 */
public class RepositoryException extends RuntimeException {

    /**
     * @param message human-readable description of what went wrong
     * @param cause   the underlying {@link java.sql.SQLException}
     */
    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Used when the repository itself detects the failure, for example an
     * update that matched no row.
     *
     * @param message human-readable description of what went wrong
     */
    public RepositoryException(String message) {
        super(message);
    }
}

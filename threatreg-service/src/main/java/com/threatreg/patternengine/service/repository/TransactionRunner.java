/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import com.threatreg.patternengine.api.exceptions.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs JDBC work inside a single database transaction.
 *
 * <p>The connection is switched to manual commit. Work that returns normally is
 * committed; work that throws anything is rolled back and the exception is rethrown.
 * {@link SQLException}s are rethrown as {@link StorageException}, registry exceptions
 * (validation, missing references) are rethrown unchanged.
 *
 * <p>Auto-commit and isolation are put back before the connection returns to the pool. If
 * that fails after the work threw, the failure is attached to the work's exception as
 * suppressed so the original error still reaches the caller.
 *
 * <p><b>Thread Safety:</b> Each call borrows its own connection from the pool.
 */
@ApplicationScoped
public class TransactionRunner {

    private static final Logger logger = Logger.getLogger(TransactionRunner.class.getName());

    private static final int KEEP_ISOLATION = -1;

    @Inject
    DataSource dataSource;

    /**
     * @param operation short description used in error messages, e.g. "create threat pattern"
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        return transactional(operation, KEEP_ISOLATION, work);
    }

    /**
     * Runs several reads against one repeatable-read snapshot, so rows read by a later
     * statement are consistent with rows read by an earlier one.
     */
    public <T> T inReadTransaction(String operation, SqlWork<T> work) {
        return transactional(operation, Connection.TRANSACTION_REPEATABLE_READ, work);
    }

    /**
     * Runs read-only work on a pooled connection in auto-commit mode.
     */
    public <T> T withConnection(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to " + operation, e);
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private <T> T transactional(String operation, int isolation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            int pooledIsolation = conn.getTransactionIsolation();
            if (isolation != KEEP_ISOLATION) {
                conn.setTransactionIsolation(isolation);
            }
            conn.setAutoCommit(false);
            T result;
            try {
                result = work.execute(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(conn, operation, e);
                try {
                    reset(conn, autoCommit, pooledIsolation);
                } catch (SQLException resetFailure) {
                    e.addSuppressed(resetFailure);
                    logger.log(Level.WARNING, "Could not reset connection after " + operation, resetFailure);
                }
                throw e;
            }
            reset(conn, autoCommit, pooledIsolation);
            return result;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to " + operation, e);
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private static void reset(Connection conn, boolean autoCommit, int isolation) throws SQLException {
        conn.setAutoCommit(autoCommit);
        if (conn.getTransactionIsolation() != isolation) {
            conn.setTransactionIsolation(isolation);
        }
    }

    private static void rollback(Connection conn, String operation, Exception cause) {
        try {
            conn.rollback();
            logger.fine("Rolled back transaction: " + operation);
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            logger.log(Level.WARNING, "Rollback failed for " + operation, rollbackFailure);
        }
    }
}

package io.tiller.server.persistence;

import java.io.Serial;

/// Unchecked exception for database persistence failures.
///
/// Wraps {@link java.sql.SQLException} and JSON codec failures so that the
/// {@link io.tiller.core.suspend.SuspendStateRepository},
/// {@link io.tiller.core.router.ConsentLedger} and
/// {@link io.tiller.core.router.SourceUsageLog} interfaces stay free of checked
/// exceptions.
///
/// @see JdbcSuspendStateRepository
/// @see JdbcConsentLedger
/// @see JdbcSourceUsageLog
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4126630785513207719L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

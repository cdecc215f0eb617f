package com.draftpilot.orchestrator.resilience;

import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLTransientException;

/**
 * Classifies database errors worth another attempt: lock/timeouts, dropped or
 * stale connections and failures to open a transaction. Constraint violations,
 * bad SQL and mapping errors are not.
 */
public final class TransientErrors {

    private TransientErrors() {}

    public static boolean isTransientDatabaseError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof CannotCreateTransactionException
                    || t instanceof SQLTransientException
                    || t instanceof ConnectException
                    || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}

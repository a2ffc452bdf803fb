package org.javai.retry.classify;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.concurrent.TimeoutException;

import org.javai.retry.RetryPredicate;

/**
 * Classifies common JDK exceptions into retryable and final failures.
 *
 * <p>Timeouts, refused connections and general I/O errors are treated as transient. Failures
 * that will not go away by waiting (unknown host, missing file, denied access, non-connection
 * SQL errors) are treated as final. Anything unrecognised is retried.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .retryPredicate(new TransientExceptionPredicate())
 *     .build();
 * }</pre>
 */
public class TransientExceptionPredicate implements RetryPredicate {

    @Override
    public boolean isRetryable(Throwable t) {
        // Network
        if (t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof ConnectException
                || t instanceof TimeoutException) {
            return true;
        }
        if (t instanceof UnknownHostException) {
            return false;
        }

        // File system: usually permanent
        if (t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || t instanceof AccessDeniedException) {
            return false;
        }

        // General IO: assume transient unless we know otherwise
        if (t instanceof IOException) {
            return true;
        }

        if (t instanceof SQLTransientException) {
            return true;
        }
        if (t instanceof SQLException sqlEx) {
            return isConnectionError(sqlEx);
        }

        return classifyUnknown(t);
    }

    /**
     * Decides for exceptions this class does not recognise. Retries by default; subclasses may
     * narrow this.
     */
    protected boolean classifyUnknown(Throwable t) {
        return true;
    }

    private static boolean isConnectionError(SQLException sqlEx) {
        // SQLSTATE class 08: connection exception
        String sqlState = sqlEx.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }
}

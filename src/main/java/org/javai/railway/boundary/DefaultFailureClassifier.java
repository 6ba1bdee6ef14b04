package org.javai.railway.boundary;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

import org.javai.railway.Cause;
import org.javai.railway.Failure;
import org.javai.railway.FailureCode;

/**
 * Default classifier for common JDK exceptions.
 *
 * <p>The failure message is always the exception's own message (its class name when the
 * message is null); only the code varies with the exception type.
 */
public class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public Failure classify(String operation, Throwable t) {
        return Failure.fault(codeFor(t), messageOf(t), Cause.fromThrowable(t));
    }

    static FailureCode codeFor(Throwable t) {
        // Network
        if (t instanceof SocketTimeoutException) {
            return FailureCode.of("network", "timeout");
        }
        if (t instanceof HttpTimeoutException) {
            return FailureCode.of("network", "http_timeout");
        }
        if (t instanceof ConnectException) {
            return FailureCode.of("network", "connection_refused");
        }
        if (t instanceof UnknownHostException) {
            return FailureCode.of("network", "unknown_host");
        }
        if (t instanceof TimeoutException) {
            return FailureCode.of("operation", "timeout");
        }

        // File system and general IO
        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return FailureCode.of("io", "file_not_found");
        }
        if (t instanceof IOException) {
            return FailureCode.of("io", "io_error");
        }

        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                return FailureCode.of("sql", "connection");
            }
            return FailureCode.of("sql", "error");
        }

        // Programming errors in the wrapped operation
        if (t instanceof IllegalArgumentException) {
            return FailureCode.of("defect", "illegal_argument");
        }
        if (t instanceof IllegalStateException) {
            return FailureCode.of("defect", "illegal_state");
        }
        if (t instanceof NullPointerException) {
            return FailureCode.of("defect", "null_pointer");
        }
        if (t instanceof UnsupportedOperationException) {
            return FailureCode.of("defect", "unsupported_operation");
        }

        String simpleName = t.getClass().getSimpleName();
        return FailureCode.of("fault", simpleName.isEmpty() ? t.getClass().getName() : simpleName);
    }

    static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}

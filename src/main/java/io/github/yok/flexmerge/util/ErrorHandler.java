package io.github.yok.flexmerge.util;

import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports errors that end a command: logs them with their stack trace and prints one concise line
 * to {@code System.err}.
 *
 * <p>
 * The process is not terminated here; {@code Main} turns a reported failure into its exit status.
 * Tests can make the current thread throw instead of printing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        throw new AssertionError("ErrorHandler must not be instantiated.");
    }

    /**
     * Makes the current thread throw {@link IllegalStateException} instead of printing.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores the default behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal error with its cause.
     *
     * @param message what failed
     * @param cause cause
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + " (" + describe(cause) + ")");
    }

    /**
     * Reports a fatal error without a cause.
     *
     * @param message what failed
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Summarizes a cause in one line. For {@link SQLException} the SQL state and vendor code of
     * the root SQL failure are included.
     *
     * @param cause cause
     * @return one-line description
     */
    static String describe(Throwable cause) {
        Throwable root = ExceptionUtils.getRootCause(cause);
        if (root == null) {
            root = cause;
        }
        SQLException sql = null;
        for (Throwable t : ExceptionUtils.getThrowableList(cause)) {
            if (t instanceof SQLException) {
                sql = (SQLException) t;
            }
        }
        String text = root.getClass().getSimpleName() + ": " + root.getMessage();
        if (sql != null && sql.getSQLState() != null) {
            text += " [SQLState=" + sql.getSQLState() + ", code=" + sql.getErrorCode() + "]";
        }
        return text;
    }
}

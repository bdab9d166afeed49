package io.github.yok.flashsync.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal run failure: logs it with the stack trace and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * It does not terminate the JVM; {@link io.github.yok.flashsync.Main} turns the failure into a
 * non-zero exit code. In tests, callers can switch to throwing an exception via a thread-local
 * flag.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Throw {@link IllegalStateException} instead of printing, for the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and cause at error level and prints the message with the root cause to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause failure
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }
}

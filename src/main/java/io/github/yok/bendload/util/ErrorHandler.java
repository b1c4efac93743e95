package io.github.yok.bendload.util;

import io.github.yok.bendload.core.LoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a load that could not complete.
 *
 * <p>
 * The loader is a command-line tool, so a fatal error is logged through SLF4J (with the stack
 * trace) and a one-line summary is echoed to {@code System.err} for the operator. This class never
 * terminates the JVM; {@link io.github.yok.bendload.Main} decides how the process ends.
 * </p>
 *
 * <p>
 * Tests can switch the current thread to "throw instead of report" mode so that a fatal path can
 * be asserted with {@code assertThrows}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes the report methods throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a load that stopped on a {@link LoadException}.
     *
     * <p>
     * The error kind is part of the message so that the operator can tell a missing source from a
     * missing table without reading the stack trace.
     * </p>
     *
     * @param table target table of the load
     * @param cause fatal error raised by the loader
     */
    public static void loadFailed(String table, LoadException cause) {
        errorAndExit("Load into " + table + " did not complete [" + cause.getKind() + "]", cause);
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + cause.getMessage());
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}

package io.github.yok.leaguerow.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal command-line errors (missing row file, unreadable JSON, structurally invalid row).
 *
 * <p>
 * Cell-level parse failures never reach this class: they are reported as unresolved fields. Only
 * conditions that prevent a row from being parsed at all are routed here.
 * </p>
 *
 * <ul>
 * <li>The full error, including the stack trace of the cause, is logged through SLF4J.</li>
 * <li>A one-line summary is written to {@code System.err} for the operator.</li>
 * <li>The JVM is not terminated; the caller returns from its run method.</li>
 * <li>Tests can switch the current thread to throwing an {@link IllegalStateException}
 * instead.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final String PREFIX = "leaguerow: ";

    private static final ThreadLocal<Boolean> THROW_INSTEAD =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Makes {@code errorAndExit} throw on the current thread instead of printing.
     */
    public static void disableExitForCurrentThread() {
        THROW_INSTEAD.set(Boolean.TRUE);
    }

    /**
     * Restores printing behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        THROW_INSTEAD.remove();
    }

    /**
     * Reports a fatal error caused by an exception.
     *
     * @param message operator-facing description of what could not be done
     * @param cause underlying exception
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_INSTEAD.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println(PREFIX + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }

    /**
     * Reports a fatal error that has no underlying exception, such as a missing argument.
     *
     * @param message operator-facing description of what could not be done
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(THROW_INSTEAD.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println(PREFIX + message);
    }
}

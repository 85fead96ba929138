package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.Thread.UncaughtExceptionHandler;

/**
 * GlobalExceptionHandler - logs any exception that escapes a thread.
 *
 * <p>The CLI reports expected failures itself; this handler catches what
 * slips past it so the cause still ends up in the log file.
 */
public final class GlobalExceptionHandler implements UncaughtExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static void install() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler();
        Thread.setDefaultUncaughtExceptionHandler(handler);
        Thread.currentThread().setUncaughtExceptionHandler(handler);
        log.debug("GlobalExceptionHandler installed.");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        log.error("UNCAUGHT EXCEPTION on thread '{}': {}", thread.getName(), throwable.getMessage(), throwable);
        AppLogger.logErrorEvent("UNCAUGHT_EXCEPTION",
                "thread=" + thread.getName() + ", exception=" + throwable.getClass().getSimpleName(),
                throwable);
    }

    /**
     * One-line description of a failure for console output.
     *
     * @param throwable the failure
     * @return the message, or the exception's simple class name if it has none
     */
    public static String describe(Throwable throwable) {
        if (throwable instanceof OutOfMemoryError) {
            return "Out of memory. Retry with a smaller --chunksize.";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        return message;
    }
}

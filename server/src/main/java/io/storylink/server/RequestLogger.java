package io.storylink.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request logging for the HTTP layer.
 *
 * One line per request with method, path, status and latency; 5xx responses
 * are logged at WARNING with the failure attached.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, PUT, DELETE, etc.)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param linkMillis  time spent waiting on link calls, or -1 if none were made
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long linkMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                linkMillis >= 0 ? ", link=" + linkMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}

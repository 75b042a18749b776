package io.lookuplite.service;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log outbound REST calls: method, path, status and latency.
 */
public final class RemoteCallLogger {
    private static final Logger log = Logger.getLogger(RemoteCallLogger.class.getName());

    private RemoteCallLogger() {
        // utility
    }

    /**
     * Log a completed outbound call.
     *
     * @param method      HTTP method (GET, POST)
     * @param path        request path, without host
     * @param status      HTTP status code, or -1 if no response was received
     * @param totalMillis wall-clock latency of the call
     * @param error       optional exception, null if none
     */
    public static void logCall(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format(
                "REST %s %s -> %s (total=%dms)",
                method,
                path,
                status < 0 ? "no response" : Integer.toString(status),
                totalMillis
        );

        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (status < 0 || status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}

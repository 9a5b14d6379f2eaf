package com.gatehouse.internal.microhttp;

import java.io.Closeable;
import java.io.IOException;

final class CloseUtils {

    private CloseUtils() {
    }

    /**
     * Closes {@code closeable}, reporting any failure to {@code logger} instead of throwing.
     */
    static void closeQuietly(Closeable closeable, Logger logger) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "close_error"));
            }
        }
    }

}

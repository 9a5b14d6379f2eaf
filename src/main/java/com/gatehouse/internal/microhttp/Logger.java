package com.gatehouse.internal.microhttp;

/**
 * Sink for transport-level events.
 * <p>
 * Every event carries an {@code event} entry naming what happened and, where applicable, an {@code id} entry
 * identifying the connection.
 */
public interface Logger {

    boolean enabled();

    void log(LogEntry... entries);

    void log(Exception e, LogEntry... entries);

}

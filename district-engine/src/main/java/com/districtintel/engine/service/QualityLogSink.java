package com.districtintel.engine.service;

import org.slf4j.event.Level;

import java.time.Instant;

/**
 * Receives data quality events raised during validation and refresh.
 */
@FunctionalInterface
public interface QualityLogSink {

    void log(Instant timestamp, Level level, String message);

    default void info(String message) {
        log(Instant.now(), Level.INFO, message);
    }

    default void warn(String message) {
        log(Instant.now(), Level.WARN, message);
    }

    default void error(String message) {
        log(Instant.now(), Level.ERROR, message);
    }
}

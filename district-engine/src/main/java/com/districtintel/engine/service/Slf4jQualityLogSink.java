package com.districtintel.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Writes quality events to the "data-quality" logger as
 * {@code [timestamp] [LEVEL] message}.
 */
@Component
public class Slf4jQualityLogSink implements QualityLogSink {

    private static final Logger QUALITY_LOG = LoggerFactory.getLogger("data-quality");

    @Override
    public void log(Instant timestamp, Level level, String message) {
        QUALITY_LOG.atLevel(level).log("[{}] [{}] {}", timestamp, level, message);
    }
}

package com.example.idreader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Configuration {
    private static final Logger log = LoggerFactory.getLogger(Configuration.class);

    // OCR lines below this confidence never reach MRZ extraction
    private float confidenceFloor = 0.4f;

    // MrzDetectionHandler settings
    private long processIntervalMs = 0;
    private boolean stopAfterFirstResult = false;

    private Configuration() {}

    public static Configuration defaults() {
        return new Builder().build();
    }

    public float getConfidenceFloor() {
        return confidenceFloor;
    }

    public long getProcessIntervalMs() {
        return processIntervalMs;
    }

    public boolean isStopAfterFirstResult() {
        return stopAfterFirstResult;
    }

    public static class Builder {
        private final Configuration config = new Configuration();

        public Builder setConfidenceFloor(float floor) {
            if (floor < 0f || floor > 1f) {
                throw new IllegalArgumentException("confidenceFloor must be within [0, 1]: " + floor);
            }
            config.confidenceFloor = floor;
            return this;
        }

        public Builder setProcessIntervalMs(long ms) {
            if (ms < 0) {
                throw new IllegalArgumentException("processIntervalMs must not be negative: " + ms);
            }
            config.processIntervalMs = ms;
            return this;
        }

        public Builder setStopAfterFirstResult(boolean stop) {
            config.stopAfterFirstResult = stop;
            return this;
        }

        public Configuration build() {
            log.debug("Building Configuration:");
            log.debug("  confidenceFloor: {}", config.confidenceFloor);
            log.debug("  processIntervalMs: {}", config.processIntervalMs);
            log.debug("  stopAfterFirstResult: {}", config.stopAfterFirstResult);

            return config;
        }
    }
}

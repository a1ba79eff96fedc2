package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TaskSettings {

    private static final Logger logger = LoggerFactory.getLogger(TaskSettings.class);

    public static final int MIN_TIMEOUT_MS = 1000;

    @JsonProperty("timeout_ms")
    private int timeoutMs = 60000;

    void validate() {
        if (timeoutMs < MIN_TIMEOUT_MS) {
            logger.warn("task.timeout_ms={} is below the minimum, using {}ms", timeoutMs, MIN_TIMEOUT_MS);
            timeoutMs = MIN_TIMEOUT_MS;
        }
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }
}

package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;

public class LoggingSettings {

    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    @JsonProperty("level")
    private String level = "INFO";

    void validate() {
        String l = level == null ? "INFO" : level.trim().toUpperCase(Locale.ROOT);
        level = LEVELS.contains(l) ? l : "INFO";
    }

    public String getLevel() {
        return level;
    }
}

package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SessionSettings {

    @JsonProperty("enabled")
    private boolean enabled = true;
    @JsonProperty("directory")
    private String directory = "./cache/sessions";
    @JsonProperty("default_name")
    private String defaultName = "default";

    void validate() {
        directory = directory == null || directory.isBlank() ? "./cache/sessions" : directory.trim();
        defaultName = defaultName == null || defaultName.isBlank() ? "default" : defaultName.trim();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public String getDefaultName() {
        return defaultName;
    }
}

package com.archivist.server.model.borgmatic;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class SystemInfo {

    @JsonProperty("borgmatic_version")
    private String borgmaticVersion;

    @JsonProperty("config_path")
    private String configPath;

    @JsonProperty("backup_path")
    private String backupPath;

    @JsonProperty("help_available")
    private boolean helpAvailable;

    // system_status 事件的 payload
    public Map<String, Object> toEventData() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("borgmatic_version", this.borgmaticVersion);
        result.put("config_path", this.configPath);
        result.put("backup_path", this.backupPath);
        result.put("help_available", this.helpAvailable);
        return result;
    }
}

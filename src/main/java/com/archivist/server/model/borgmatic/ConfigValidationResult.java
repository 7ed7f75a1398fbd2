package com.archivist.server.model.borgmatic;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
public class ConfigValidationResult {

    private boolean valid;

    // 解析后的配置, 仅在 valid 时有值
    private Map<String, Object> config;

    private List<String> warnings = new ArrayList<>();

    private List<String> errors = new ArrayList<>();

    public String getError() {
        return this.valid ? null : String.join("; ", this.errors);
    }
}

package com.archivist.server.controller;

import com.archivist.server.model.api.config.ValidateConfigRequest;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.borgmatic.ConfigValidationResult;
import com.archivist.server.model.borgmatic.SystemInfo;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.service.borgmatic.BorgmaticService;
import com.archivist.server.util.CommandResultUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/system-info")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class SystemInfoController {

    private final BorgmaticService borgmaticService;

    private final ArchivistSettings archivistSettings;

    @Autowired
    public SystemInfoController(BorgmaticService borgmaticService, ArchivistSettings archivistSettings) {
        this.borgmaticService = borgmaticService;
        this.archivistSettings = archivistSettings;
    }

    @GetMapping("/get-version")
    public ArchivistHttpResponse<String> getVersion() {
        CommandResult versionResult = CommandResultUtil.requireSuccess(this.borgmaticService.getVersion(), "getVersion");
        return ArchivistHttpResponse.success(versionResult.getStdout().trim());
    }

    @GetMapping("/get-system-info")
    public ArchivistHttpResponse<SystemInfo> getSystemInfo() {
        return ArchivistHttpResponse.success(this.borgmaticService.getSystemInfo());
    }

    @GetMapping("/get-system-settings")
    public ArchivistHttpResponse<ArchivistSettings> getSystemSettings() {
        return ArchivistHttpResponse.success(this.archivistSettings);
    }

    @GetMapping("/get-config-info")
    public ArchivistHttpResponse<Map<String, Object>> getConfigInfo() {
        return ArchivistHttpResponse.success(this.borgmaticService.getConfigInfo());
    }

    @PostMapping("/validate-config")
    public ArchivistHttpResponse<ConfigValidationResult> validateConfig(
            @RequestBody ValidateConfigRequest validateConfigRequest) {
        ConfigValidationResult result = this.borgmaticService.validateConfig(validateConfigRequest.getContent());
        return ArchivistHttpResponse.success(result,
                result.isValid() ? "Configuration is valid" : "Configuration is invalid");
    }
}

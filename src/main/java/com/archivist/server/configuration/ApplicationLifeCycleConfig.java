package com.archivist.server.configuration;

import com.archivist.server.service.bussiness.SystemManagementService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@ConditionalOnProperty(name = "archivist.server.startup-check", havingValue = "true", matchIfMissing = true)
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final SystemManagementService systemManagementService;

    @Autowired
    public ApplicationLifeCycleConfig(SystemManagementService systemManagementService) {
        this.systemManagementService = systemManagementService;
    }

    @PostConstruct
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        // borgmatic 不可用则启动失败
        this.systemManagementService.checkBorgmaticInstallation();
    }
}

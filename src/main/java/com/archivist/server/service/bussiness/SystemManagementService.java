package com.archivist.server.service.bussiness;

import com.archivist.server.bus.EventBus;
import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.exception.BusinessException;
import com.archivist.server.model.borgmatic.SystemInfo;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.service.borgmatic.BorgmaticService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SystemManagementService {

    private final BorgmaticService borgmaticService;

    private final EventBus eventBus;

    @Autowired
    public SystemManagementService(BorgmaticService borgmaticService, EventBus eventBus) {
        this.borgmaticService = borgmaticService;
        this.eventBus = eventBus;
    }

    /**
     * Startup check. Nothing else can work without borgmatic, so a failure aborts start-up.
     */
    public String checkBorgmaticInstallation() throws BusinessException {
        CommandResult versionResult = this.borgmaticService.getVersion();
        if (!versionResult.isSuccess()) {
            throw new BusinessException("checkBorgmaticInstallation failed. borgmatic not available. " +
                    "exitCode:%s, stderr:%s".formatted(versionResult.getExitCode(), versionResult.getStderr()));
        }
        String version = versionResult.getStdout().trim();
        log.info("borgmatic found. version:{}", version);
        return version;
    }

    // fixDelay 30 seconds. unit is millisecond
    @Scheduled(
            initialDelayString = "${archivist.server.events.system-status-interval-millis:30000}",
            fixedDelayString = "${archivist.server.events.system-status-interval-millis:30000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void broadcastSystemStatus() {
        // 没有订阅者时不调用 borgmatic
        if (this.eventBus.getSubscriberCount() == 0) {
            return;
        }
        try {
            SystemInfo systemInfo = this.borgmaticService.getSystemInfo();
            int delivered = this.eventBus.publish(EventTypeEnum.SYSTEM_STATUS, systemInfo.toEventData());
            log.debug("system status broadcast. delivered:{}", delivered);
        } catch (RuntimeException e) {
            log.error("broadcastSystemStatus failed.", e);
        }
    }
}

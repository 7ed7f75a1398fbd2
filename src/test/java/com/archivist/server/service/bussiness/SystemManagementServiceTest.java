package com.archivist.server.service.bussiness;

import com.archivist.server.bus.EventBus;
import com.archivist.server.bus.Subscriber;
import com.archivist.server.exception.BusinessException;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.borgmatic.SystemInfo;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.model.internal.ArchivistEvent;
import com.archivist.server.service.borgmatic.BorgmaticService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SystemManagementServiceTest {

    private BorgmaticService borgmaticService;

    private EventBus eventBus;

    private SystemManagementService systemManagementService;

    @BeforeEach
    void setUp() {
        borgmaticService = mock(BorgmaticService.class);
        eventBus = new EventBus(
                new ArchivistSettings(),
                Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
        systemManagementService = new SystemManagementService(borgmaticService, eventBus);
    }

    @Test
    void installationCheckReturnsVersion() {
        when(borgmaticService.getVersion()).thenReturn(CommandResult.success("1.8.9\n"));

        assertEquals("1.8.9", systemManagementService.checkBorgmaticInstallation());
    }

    @Test
    void missingBorgmaticFailsCheck() {
        when(borgmaticService.getVersion()).thenReturn(CommandResult.failed("No such file or directory"));

        assertThrows(BusinessException.class, () -> systemManagementService.checkBorgmaticInstallation());
    }

    @Test
    void noBroadcastWithoutSubscribers() {
        systemManagementService.broadcastSystemStatus();

        verifyNoInteractions(borgmaticService);
    }

    @Test
    void broadcastReachesSubscribers() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        SystemInfo systemInfo = new SystemInfo();
        systemInfo.setBorgmaticVersion("1.8.9");
        when(borgmaticService.getSystemInfo()).thenReturn(systemInfo);

        systemManagementService.broadcastSystemStatus();

        ArchivistEvent event = alice.poll(Duration.ofMillis(100));
        assertNotNull(event);
        assertEquals("system_status", event.getType());
        assertEquals("1.8.9", event.getData().get("borgmatic_version"));
    }
}

package com.archivist.server.service.bussiness;

import com.archivist.server.bus.EventBus;
import com.archivist.server.bus.Subscriber;
import com.archivist.server.enums.BackupJobStatusEnum;
import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.exception.ResourceNotFoundException;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.model.internal.ArchivistEvent;
import com.archivist.server.model.internal.BackupRunResult;
import com.archivist.server.service.borgmatic.BorgmaticService;
import com.archivist.server.service.db.IBackupJobRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BackupJobFacadeServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    private BorgmaticService borgmaticService;

    private IBackupJobRunService backupJobRunService;

    private EventBus eventBus;

    private BackupJobFacadeService backupJobFacadeService;

    @BeforeEach
    void setUp() {
        borgmaticService = mock(BorgmaticService.class);
        backupJobRunService = mock(IBackupJobRunService.class);
        eventBus = new EventBus(new ArchivistSettings(), CLOCK);
        // 同步执行, 便于断言
        backupJobFacadeService = new BackupJobFacadeService(
                borgmaticService, backupJobRunService, eventBus, Runnable::run, CLOCK);
    }

    private BackupJobRunEntity runningRun(long id, String principal) {
        BackupJobRunEntity entity = new BackupJobRunEntity();
        entity.setBackupJobRunId(id);
        entity.setRepository("repo-a");
        entity.setBackupJobStatus(BackupJobStatusEnum.RUNNING.getName());
        entity.setProgress(0);
        entity.setPrincipal(principal);
        entity.setStartedAt(NOW);
        return entity;
    }

    private static List<ArchivistEvent> drain(Subscriber subscriber) throws InterruptedException {
        List<ArchivistEvent> events = new ArrayList<>();
        ArchivistEvent event;
        while ((event = subscriber.poll(Duration.ofMillis(10))) != null) {
            events.add(event);
        }
        return events;
    }

    @Test
    void successfulBackupCompletesRun() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        BackupJobRunEntity run = runningRun(11L, "alice");
        when(backupJobRunService.addBackupJobRun("repo-a", BackupTriggerEnum.MANUAL, null, "alice", NOW))
                .thenReturn(run);
        when(borgmaticService.runBackup("repo-a", null)).thenReturn(CommandResult.success("archive created"));
        when(backupJobRunService.updateAsCompleted(11L, "archive created", NOW)).thenReturn(true);

        BackupJobRunEntity started = backupJobFacadeService.startBackup("repo-a", null, "alice");

        assertEquals(11L, started.getBackupJobRunId());
        verify(backupJobRunService).updateAsCompleted(11L, "archive created", NOW);
        verify(backupJobRunService, never()).updateAsFailed(anyLong(), any(), any(), any());
        List<ArchivistEvent> events = drain(alice);
        assertEquals(2, events.size());
        assertEquals("starting", events.get(0).getData().get("status"));
        assertEquals("completed", events.get(1).getData().get("status"));
        assertEquals(100, events.get(1).getData().get("progress"));
        assertEquals(11L, events.get(1).getData().get("job_id"));
    }

    @Test
    void failedBackupRecordsStderr() throws InterruptedException {
        Subscriber bob = eventBus.subscribe("bob");
        when(backupJobRunService.addBackupJobRun(any(), any(), any(), any(), any()))
                .thenReturn(runningRun(12L, null));
        when(borgmaticService.runBackup("repo-a", null))
                .thenReturn(CommandResult.failed(2, "partial", "Repository locked"));
        when(backupJobRunService.updateAsFailed(12L, "partial", "Repository locked", NOW)).thenReturn(true);

        backupJobFacadeService.startBackup("repo-a", null, null);

        verify(backupJobRunService).updateAsFailed(12L, "partial", "Repository locked", NOW);
        // 没有 principal 时广播
        List<ArchivistEvent> events = drain(bob);
        assertEquals("failed", events.get(events.size() - 1).getData().get("status"));
        assertEquals("Backup failed: Repository locked", events.get(events.size() - 1).getData().get("message"));
    }

    @Test
    void busyRepositoryIsRejectedWithoutRecord() {
        when(borgmaticService.isRepositoryBusy("repo-a")).thenReturn(true);

        ValidationException e = assertThrows(ValidationException.class,
                () -> backupJobFacadeService.startBackup("repo-a", null, "alice"));

        assertTrue(e.getMessage().contains("repo-a"));
        verifyNoInteractions(backupJobRunService);
        verify(borgmaticService, never()).runBackup(any(), any());
    }

    @Test
    void outcomeAfterCancelIsDiscarded() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        when(backupJobRunService.addBackupJobRun(any(), any(), any(), any(), any()))
                .thenReturn(runningRun(13L, "alice"));
        when(borgmaticService.runBackup("repo-a", null)).thenReturn(CommandResult.success("late"));
        // 已被 cancel, 条件更新不生效
        when(backupJobRunService.updateAsCompleted(13L, "late", NOW)).thenReturn(false);

        backupJobFacadeService.startBackup("repo-a", null, "alice");

        List<ArchivistEvent> events = drain(alice);
        assertEquals(1, events.size());
        assertEquals("starting", events.get(0).getData().get("status"));
    }

    @Test
    void runBackupReturnsRefreshedRecord() {
        BackupJobRunEntity run = runningRun(14L, null);
        BackupJobRunEntity completed = runningRun(14L, null);
        completed.setBackupJobStatus(BackupJobStatusEnum.COMPLETED.getName());
        when(backupJobRunService.addBackupJobRun("repo-a", BackupTriggerEnum.SCHEDULED, 3L, null, NOW))
                .thenReturn(run);
        when(borgmaticService.runBackup("repo-a", "cfg.yaml")).thenReturn(CommandResult.success(""));
        when(backupJobRunService.updateAsCompleted(14L, "", NOW)).thenReturn(true);
        when(backupJobRunService.getByBackupJobRunId(14L)).thenReturn(completed);

        BackupRunResult result = backupJobFacadeService.runBackup(
                "repo-a", "cfg.yaml", BackupTriggerEnum.SCHEDULED, 3L, null);

        assertTrue(result.isSuccess());
        assertEquals("completed", result.getBackupJobRun().getBackupJobStatus());
    }

    @Test
    void cancelRunningRun() throws InterruptedException {
        Subscriber alice = eventBus.subscribe("alice");
        BackupJobRunEntity cancelled = runningRun(15L, "alice");
        cancelled.setBackupJobStatus(BackupJobStatusEnum.CANCELLED.getName());
        when(backupJobRunService.getByBackupJobRunId(15L))
                .thenReturn(runningRun(15L, "alice"))
                .thenReturn(cancelled);
        when(backupJobRunService.updateAsCancelled(15L, NOW)).thenReturn(true);

        BackupJobRunEntity result = backupJobFacadeService.cancel(15L);

        assertEquals("cancelled", result.getBackupJobStatus());
        assertEquals("cancelled", drain(alice).get(0).getData().get("status"));
    }

    @Test
    void cancelFinishedRunIsRejected() {
        BackupJobRunEntity completed = runningRun(16L, null);
        completed.setBackupJobStatus(BackupJobStatusEnum.COMPLETED.getName());
        when(backupJobRunService.getByBackupJobRunId(16L)).thenReturn(completed);

        assertThrows(ValidationException.class, () -> backupJobFacadeService.cancel(16L));
        verify(backupJobRunService, never()).updateAsCancelled(anyLong(), any());
    }

    @Test
    void cancelLosingRaceIsRejected() {
        when(backupJobRunService.getByBackupJobRunId(17L)).thenReturn(runningRun(17L, null));
        when(backupJobRunService.updateAsCancelled(17L, NOW)).thenReturn(false);

        assertThrows(ValidationException.class, () -> backupJobFacadeService.cancel(17L));
    }

    @Test
    void unknownRunIsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> backupJobFacadeService.getRun(99L));
        assertThrows(ResourceNotFoundException.class, () -> backupJobFacadeService.cancel(99L));
    }

    @Test
    void recentRunsLimitIsBounded() {
        assertThrows(ValidationException.class, () -> backupJobFacadeService.listRecentRuns(0));
        assertThrows(ValidationException.class, () -> backupJobFacadeService.listRecentRuns(1001));

        backupJobFacadeService.listRecentRuns(20);
        verify(backupJobRunService).getRecentRuns(20);
    }
}

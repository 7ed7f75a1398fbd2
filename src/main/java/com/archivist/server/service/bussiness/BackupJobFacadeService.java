package com.archivist.server.service.bussiness;

import com.archivist.server.bus.EventBus;
import com.archivist.server.enums.BackupJobStatusEnum;
import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.exception.DbException;
import com.archivist.server.exception.ResourceNotFoundException;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.model.internal.BackupRunResult;
import com.archivist.server.service.borgmatic.BorgmaticService;
import com.archivist.server.service.db.IBackupJobRunService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping around a backup: one {@link BackupJobRunEntity} per attempt, moved exactly once from
 * running to a terminal status, with backup_progress events along the way.
 */
@Slf4j
@Service
public class BackupJobFacadeService {

    private static final int EVENT_MESSAGE_MAX_LENGTH = 500;

    private final BorgmaticService borgmaticService;

    private final IBackupJobRunService backupJobRunService;

    private final EventBus eventBus;

    private final TaskExecutor generalTaskExecutor;

    private final Clock clock;

    @Autowired
    public BackupJobFacadeService(
            BorgmaticService borgmaticService,
            IBackupJobRunService backupJobRunService,
            EventBus eventBus,
            @Qualifier("generalTaskScheduler") TaskExecutor generalTaskExecutor,
            Clock clock) {
        this.borgmaticService = borgmaticService;
        this.backupJobRunService = backupJobRunService;
        this.eventBus = eventBus;
        this.generalTaskExecutor = generalTaskExecutor;
        this.clock = clock;
    }

    /**
     * Records a manual run and executes it on the general task pool.
     *
     * @return the run record, still running
     */
    public BackupJobRunEntity startBackup(String repository, String configFile, String principal)
            throws ValidationException, DbException {
        // 已经在跑的 repository 直接拒绝, 不落记录
        if (this.borgmaticService.isRepositoryBusy(repository)) {
            throw new ValidationException("startBackup failed. backup already running for repository %s"
                    .formatted(StringUtils.defaultIfBlank(repository, BorgmaticService.DEFAULT_REPOSITORY_KEY)));
        }
        BackupJobRunEntity backupJobRun = this.createRun(repository, BackupTriggerEnum.MANUAL, null, principal);
        this.generalTaskExecutor.execute(() -> {
            try {
                this.executeRun(backupJobRun, repository, configFile, principal);
            } catch (RuntimeException e) {
                log.error("startBackup failed. backupJobRunId:{}", backupJobRun.getBackupJobRunId(), e);
            }
        });
        return backupJobRun;
    }

    /**
     * Records a run and executes it on the calling thread.
     */
    public BackupRunResult runBackup(
            String repository,
            String configFile,
            BackupTriggerEnum backupTrigger,
            Long scheduledJobId,
            String principal) throws DbException {
        BackupJobRunEntity backupJobRun = this.createRun(repository, backupTrigger, scheduledJobId, principal);
        CommandResult commandResult = this.executeRun(backupJobRun, repository, configFile, principal);
        BackupJobRunEntity refreshed = this.backupJobRunService.getByBackupJobRunId(
                backupJobRun.getBackupJobRunId());
        return new BackupRunResult(ObjectUtils.defaultIfNull(refreshed, backupJobRun), commandResult);
    }

    /**
     * Marks a running run as cancelled. The borgmatic process, if any, keeps running until it exits
     * or times out; its outcome is then discarded.
     */
    public BackupJobRunEntity cancel(long backupJobRunId) throws ResourceNotFoundException, ValidationException {
        BackupJobRunEntity backupJobRun = this.getRun(backupJobRunId);
        if (BackupJobStatusEnum.isTransitionProhibit(
                backupJobRun.getBackupJobStatus(), BackupJobStatusEnum.CANCELLED)) {
            throw new ValidationException("cancel failed. backupJobRunId %s is %s, only running can be cancelled"
                    .formatted(backupJobRunId, backupJobRun.getBackupJobStatus()));
        }
        boolean updated = this.backupJobRunService.updateAsCancelled(backupJobRunId, this.now());
        if (!updated) {
            throw new ValidationException("cancel failed. backupJobRunId %s finished meanwhile"
                    .formatted(backupJobRunId));
        }
        log.info("backup run cancelled. backupJobRunId:{}, repository:{}",
                backupJobRunId, backupJobRun.getRepository());
        this.publishProgress(backupJobRun.getPrincipal(), backupJobRunId, backupJobRun.getProgress(),
                BackupJobStatusEnum.CANCELLED.getName(), "Backup cancelled");
        return this.getRun(backupJobRunId);
    }

    public BackupJobRunEntity getRun(long backupJobRunId) throws ResourceNotFoundException {
        BackupJobRunEntity backupJobRun = this.backupJobRunService.getByBackupJobRunId(backupJobRunId);
        if (ObjectUtils.isEmpty(backupJobRun)) {
            throw new ResourceNotFoundException("getRun failed. backupJobRunId %s not found".formatted(backupJobRunId));
        }
        return backupJobRun;
    }

    public String getRunLogs(long backupJobRunId) throws ResourceNotFoundException {
        return StringUtils.defaultString(this.getRun(backupJobRunId).getLogs());
    }

    public List<BackupJobRunEntity> listRecentRuns(int limit) throws ValidationException {
        if (limit < 1 || limit > 1000) {
            throw new ValidationException("listRecentRuns failed. limit %s out of range [1, 1000]".formatted(limit));
        }
        return this.backupJobRunService.getRecentRuns(limit);
    }

    private BackupJobRunEntity createRun(
            String repository,
            BackupTriggerEnum backupTrigger,
            Long scheduledJobId,
            String principal) throws DbException {
        BackupJobRunEntity backupJobRun = this.backupJobRunService.addBackupJobRun(
                repository, backupTrigger, scheduledJobId, principal, this.now());
        log.info("backup run created. backupJobRunId:{}, repository:{}, trigger:{}",
                backupJobRun.getBackupJobRunId(), backupJobRun.getRepository(), backupTrigger);
        this.publishProgress(principal, backupJobRun.getBackupJobRunId(), 0,
                "starting", "Backup started");
        return backupJobRun;
    }

    private CommandResult executeRun(
            BackupJobRunEntity backupJobRun,
            String repository,
            String configFile,
            String principal) throws DbException {
        long backupJobRunId = backupJobRun.getBackupJobRunId();
        CommandResult commandResult = this.borgmaticService.runBackup(repository, configFile);
        boolean updated;
        if (commandResult.isSuccess()) {
            updated = this.backupJobRunService.updateAsCompleted(
                    backupJobRunId, commandResult.getStdout(), this.now());
        } else {
            updated = this.backupJobRunService.updateAsFailed(
                    backupJobRunId, commandResult.getStdout(), commandResult.getStderr(), this.now());
        }
        // 期间被 cancel, 保持 cancelled
        if (!updated) {
            log.info("backup run finished after it left running, outcome discarded. backupJobRunId:{}, exitCode:{}",
                    backupJobRunId, commandResult.getExitCode());
            return commandResult;
        }
        if (commandResult.isSuccess()) {
            this.publishProgress(principal, backupJobRunId, 100,
                    BackupJobStatusEnum.COMPLETED.getName(), "Backup completed successfully");
        } else {
            this.publishProgress(principal, backupJobRunId, backupJobRun.getProgress(),
                    BackupJobStatusEnum.FAILED.getName(),
                    "Backup failed: " + StringUtils.abbreviate(commandResult.getStderr(), EVENT_MESSAGE_MAX_LENGTH));
        }
        return commandResult;
    }

    // 有 principal 时只发给该用户, 否则广播
    private void publishProgress(String principal, long jobId, Integer progress, String status, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("progress", ObjectUtils.defaultIfNull(progress, 0));
        data.put("status", status);
        data.put("message", message);
        this.eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, data, StringUtils.trimToNull(principal));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(this.clock);
    }
}

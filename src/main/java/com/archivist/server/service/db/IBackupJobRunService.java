package com.archivist.server.service.db;

import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.time.LocalDateTime;
import java.util.List;

public interface IBackupJobRunService extends IService<BackupJobRunEntity> {

    BackupJobRunEntity addBackupJobRun(
            String repository,
            BackupTriggerEnum backupTrigger,
            Long scheduledJobId,
            String principal,
            LocalDateTime startedAt);

    BackupJobRunEntity getByBackupJobRunId(long backupJobRunId);

    List<BackupJobRunEntity> getRecentRuns(int limit);

    boolean updateAsCompleted(long backupJobRunId, String logs, LocalDateTime completedAt);

    boolean updateAsFailed(long backupJobRunId, String logs, String errorMessage, LocalDateTime completedAt);

    boolean updateAsCancelled(long backupJobRunId, LocalDateTime completedAt);
}

package com.archivist.server.model.api.backup;

import com.archivist.server.model.entity.BackupJobRunEntity;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;

@Data
public class BackupRunInfo {

    private String backupJobRunId;

    private String repository;

    private String status;

    private int progress;

    private String errorMessage;

    private String trigger;

    private String scheduledJobId;

    private String startedAt = "";

    private String completedAt = "";

    public BackupRunInfo(BackupJobRunEntity backupJobRunEntity) {
        this.backupJobRunId = backupJobRunEntity.getBackupJobRunId().toString();
        this.repository = backupJobRunEntity.getRepository();
        this.status = backupJobRunEntity.getBackupJobStatus();
        this.progress = ObjectUtils.defaultIfNull(backupJobRunEntity.getProgress(), 0);
        this.errorMessage = backupJobRunEntity.getErrorMessage();
        this.trigger = backupJobRunEntity.getBackupTrigger();
        if (ObjectUtils.isNotEmpty(backupJobRunEntity.getScheduledJobId())) {
            this.scheduledJobId = backupJobRunEntity.getScheduledJobId().toString();
        }
        if (ObjectUtils.isNotEmpty(backupJobRunEntity.getStartedAt())) {
            this.startedAt = backupJobRunEntity.getStartedAt().toString();
        }
        if (ObjectUtils.isNotEmpty(backupJobRunEntity.getCompletedAt())) {
            this.completedAt = backupJobRunEntity.getCompletedAt().toString();
        }
    }
}

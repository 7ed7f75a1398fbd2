package com.archivist.server.service.db.impl;

import com.archivist.server.enums.BackupJobStatusEnum;
import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.enums.DeletedEnum;
import com.archivist.server.exception.DbException;
import com.archivist.server.mapper.BackupJobRunMapper;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.service.db.IBackupJobRunService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class BackupJobRunService
        extends ServiceImpl<BackupJobRunMapper, BackupJobRunEntity>
        implements IBackupJobRunService {

    @Override
    public BackupJobRunEntity addBackupJobRun(
            String repository,
            BackupTriggerEnum backupTrigger,
            Long scheduledJobId,
            String principal,
            LocalDateTime startedAt) throws DbException {
        BackupJobRunEntity backupJobRunEntity = new BackupJobRunEntity();
        backupJobRunEntity.setRepository(StringUtils.defaultIfBlank(repository, "default"));
        backupJobRunEntity.setBackupJobStatus(BackupJobStatusEnum.RUNNING.getName());
        backupJobRunEntity.setProgress(0);
        backupJobRunEntity.setBackupTrigger(backupTrigger.name());
        backupJobRunEntity.setScheduledJobId(scheduledJobId);
        backupJobRunEntity.setPrincipal(principal);
        backupJobRunEntity.setStartedAt(startedAt);
        boolean saved = this.save(backupJobRunEntity);
        if (!saved) {
            throw new DbException("addBackupJobRun failed. can't write to database.");
        }
        return backupJobRunEntity;
    }

    @Override
    public BackupJobRunEntity getByBackupJobRunId(long backupJobRunId) {
        LambdaQueryWrapper<BackupJobRunEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(BackupJobRunEntity::getBackupJobRunId, backupJobRunId);
        queryWrapper.eq(BackupJobRunEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());

        List<BackupJobRunEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    @Override
    public List<BackupJobRunEntity> getRecentRuns(int limit) {
        LambdaQueryWrapper<BackupJobRunEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(BackupJobRunEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByDesc(BackupJobRunEntity::getBackupJobRunId);
        queryWrapper.last("LIMIT " + Math.max(1, limit));

        return this.list(queryWrapper);
    }

    @Override
    public boolean updateAsCompleted(long backupJobRunId, String logs, LocalDateTime completedAt) {
        LambdaUpdateWrapper<BackupJobRunEntity> updateWrapper = this.runningOnly(backupJobRunId);
        updateWrapper.set(BackupJobRunEntity::getBackupJobStatus, BackupJobStatusEnum.COMPLETED.getName());
        updateWrapper.set(BackupJobRunEntity::getProgress, 100);
        updateWrapper.set(BackupJobRunEntity::getLogs, StringUtils.defaultString(logs));
        updateWrapper.set(BackupJobRunEntity::getCompletedAt, completedAt);
        return this.update(updateWrapper);
    }

    @Override
    public boolean updateAsFailed(
            long backupJobRunId,
            String logs,
            String errorMessage,
            LocalDateTime completedAt) {
        LambdaUpdateWrapper<BackupJobRunEntity> updateWrapper = this.runningOnly(backupJobRunId);
        updateWrapper.set(BackupJobRunEntity::getBackupJobStatus, BackupJobStatusEnum.FAILED.getName());
        updateWrapper.set(BackupJobRunEntity::getLogs, StringUtils.defaultString(logs));
        updateWrapper.set(BackupJobRunEntity::getErrorMessage, StringUtils.defaultString(errorMessage));
        updateWrapper.set(BackupJobRunEntity::getCompletedAt, completedAt);
        return this.update(updateWrapper);
    }

    @Override
    public boolean updateAsCancelled(long backupJobRunId, LocalDateTime completedAt) {
        LambdaUpdateWrapper<BackupJobRunEntity> updateWrapper = this.runningOnly(backupJobRunId);
        updateWrapper.set(BackupJobRunEntity::getBackupJobStatus, BackupJobStatusEnum.CANCELLED.getName());
        updateWrapper.set(BackupJobRunEntity::getCompletedAt, completedAt);
        return this.update(updateWrapper);
    }

    // 只更新仍处于 running 的记录, 终态记录不会被覆盖
    private LambdaUpdateWrapper<BackupJobRunEntity> runningOnly(long backupJobRunId) {
        LambdaUpdateWrapper<BackupJobRunEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(BackupJobRunEntity::getBackupJobRunId, backupJobRunId);
        updateWrapper.eq(BackupJobRunEntity::getBackupJobStatus, BackupJobStatusEnum.RUNNING.getName());
        return updateWrapper;
    }
}

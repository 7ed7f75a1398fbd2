package com.archivist.server.service.db.impl;

import com.archivist.server.enums.DeletedEnum;
import com.archivist.server.exception.DbException;
import com.archivist.server.mapper.ScheduledJobMapper;
import com.archivist.server.model.entity.ScheduledJobEntity;
import com.archivist.server.service.db.IScheduledJobService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class ScheduledJobService
        extends ServiceImpl<ScheduledJobMapper, ScheduledJobEntity>
        implements IScheduledJobService {

    @Override
    public ScheduledJobEntity addScheduledJob(ScheduledJobEntity scheduledJobEntity) throws DbException {
        boolean saved = this.save(scheduledJobEntity);
        if (!saved) {
            throw new DbException("addScheduledJob failed. can't write to database.");
        }
        return scheduledJobEntity;
    }

    @Override
    public ScheduledJobEntity getByScheduledJobId(long scheduledJobId) {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getScheduledJobId, scheduledJobId);
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());

        List<ScheduledJobEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    @Override
    public List<ScheduledJobEntity> getAllScheduledJob() {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByAsc(ScheduledJobEntity::getScheduledJobId);

        return this.list(queryWrapper);
    }

    // enabled 且 next run <= now, 按 id 排序保证每轮顺序稳定
    @Override
    public List<ScheduledJobEntity> getDueJobs(LocalDateTime now) {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getEnabled, true);
        queryWrapper.isNotNull(ScheduledJobEntity::getNextRun);
        queryWrapper.le(ScheduledJobEntity::getNextRun, now);
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByAsc(ScheduledJobEntity::getScheduledJobId);

        return this.list(queryWrapper);
    }

    // last run / next run 归调度器所有, 这里只在重新计算过 next run 时才写
    @Override
    public void updateScheduledJob(ScheduledJobEntity scheduledJobEntity, boolean withNextRun) throws DbException {
        LambdaUpdateWrapper<ScheduledJobEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(ScheduledJobEntity::getScheduledJobId, scheduledJobEntity.getScheduledJobId());
        updateWrapper.set(ScheduledJobEntity::getJobName, scheduledJobEntity.getJobName());
        updateWrapper.set(ScheduledJobEntity::getCronExpression, scheduledJobEntity.getCronExpression());
        updateWrapper.set(ScheduledJobEntity::getRepository, scheduledJobEntity.getRepository());
        updateWrapper.set(ScheduledJobEntity::getConfigFile, scheduledJobEntity.getConfigFile());
        updateWrapper.set(ScheduledJobEntity::getEnabled, scheduledJobEntity.getEnabled());
        updateWrapper.set(ScheduledJobEntity::getDescription, scheduledJobEntity.getDescription());
        if (withNextRun) {
            updateWrapper.set(ScheduledJobEntity::getNextRun, scheduledJobEntity.getNextRun());
        }
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateScheduledJob failed. can't write to database. " +
                    "scheduledJobId is %s".formatted(scheduledJobEntity.getScheduledJobId()));
        }
    }

    // 只写 last run / next run, 不覆盖管理员同时做的 enable/disable
    @Override
    public void updateRunTimes(long scheduledJobId, LocalDateTime lastRun, LocalDateTime nextRun) throws DbException {
        LambdaUpdateWrapper<ScheduledJobEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(ScheduledJobEntity::getScheduledJobId, scheduledJobId);
        updateWrapper.set(ScheduledJobEntity::getLastRun, lastRun);
        updateWrapper.set(ScheduledJobEntity::getNextRun, nextRun);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateRunTimes failed. can't write to database. " +
                    "scheduledJobId is %s".formatted(scheduledJobId));
        }
    }

    @Override
    public void deleteScheduledJob(ScheduledJobEntity scheduledJobEntity) throws DbException {
        // 逻辑删除
        scheduledJobEntity.setRecordDeleted(DeletedEnum.DELETED.getCode());
        scheduledJobEntity.setEnabled(false);
        boolean updated = this.updateById(scheduledJobEntity);
        if (!updated) {
            throw new DbException("deleteScheduledJob failed. can't write to database. " +
                    "scheduledJobId is %s".formatted(scheduledJobEntity.getScheduledJobId()));
        }
    }
}

package com.archivist.server.service.db;

import com.archivist.server.model.entity.ScheduledJobEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.time.LocalDateTime;
import java.util.List;

public interface IScheduledJobService extends IService<ScheduledJobEntity> {

    ScheduledJobEntity addScheduledJob(ScheduledJobEntity scheduledJobEntity);

    ScheduledJobEntity getByScheduledJobId(long scheduledJobId);

    List<ScheduledJobEntity> getAllScheduledJob();

    List<ScheduledJobEntity> getDueJobs(LocalDateTime now);

    /**
     * Writes the columns an administrator owns. next_run is written only when {@code withNextRun}
     * is set; last_run is never written here.
     */
    void updateScheduledJob(ScheduledJobEntity scheduledJobEntity, boolean withNextRun);

    void updateRunTimes(long scheduledJobId, LocalDateTime lastRun, LocalDateTime nextRun);

    void deleteScheduledJob(ScheduledJobEntity scheduledJobEntity);
}

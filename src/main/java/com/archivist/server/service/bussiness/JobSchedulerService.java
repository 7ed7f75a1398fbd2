package com.archivist.server.service.bussiness;

import com.archivist.server.bus.EventBus;
import com.archivist.server.enums.BackupJobStatusEnum;
import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.enums.ScheduledJobStateEnum;
import com.archivist.server.exception.BusinessException;
import com.archivist.server.exception.DbException;
import com.archivist.server.exception.ResourceNotFoundException;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.schedule.CreateScheduledJobRequest;
import com.archivist.server.model.api.schedule.CronPreview;
import com.archivist.server.model.api.schedule.UpdateScheduledJobRequest;
import com.archivist.server.model.entity.ScheduledJobEntity;
import com.archivist.server.model.internal.BackupRunResult;
import com.archivist.server.service.db.IScheduledJobService;
import com.archivist.server.util.CronUtil;
import com.archivist.server.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the recurring backup definitions. A job is due when it is enabled and its next run is not in
 * the future; after every run, scheduled or manual, last run is set to the completion time and next
 * run is computed from that time.
 */
@Slf4j
@Service
public class JobSchedulerService {

    public static final int DETAIL_UPCOMING_RUNS = 5;

    public static final int PREVIEW_UPCOMING_RUNS = 10;

    private static final int EVENT_MESSAGE_MAX_LENGTH = 500;

    private final IScheduledJobService scheduledJobService;

    private final BackupJobFacadeService backupJobFacadeService;

    private final EventBus eventBus;

    private final Clock clock;

    @Autowired
    public JobSchedulerService(
            IScheduledJobService scheduledJobService,
            BackupJobFacadeService backupJobFacadeService,
            EventBus eventBus,
            Clock clock) {
        this.scheduledJobService = scheduledJobService;
        this.backupJobFacadeService = backupJobFacadeService;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public ScheduledJobEntity createJob(CreateScheduledJobRequest createScheduledJobRequest)
            throws ValidationException, DbException {
        EntityValidationUtil.isCreateScheduledJobRequestValid(createScheduledJobRequest);
        ScheduledJobEntity scheduledJobEntity = new ScheduledJobEntity();
        scheduledJobEntity.setJobName(createScheduledJobRequest.getName().trim());
        scheduledJobEntity.setCronExpression(createScheduledJobRequest.getCronExpression().trim());
        scheduledJobEntity.setRepository(StringUtils.trimToNull(createScheduledJobRequest.getRepository()));
        scheduledJobEntity.setConfigFile(StringUtils.trimToNull(createScheduledJobRequest.getConfigFile()));
        scheduledJobEntity.setEnabled(!Boolean.FALSE.equals(createScheduledJobRequest.getEnabled()));
        scheduledJobEntity.setDescription(createScheduledJobRequest.getDescription());
        scheduledJobEntity.setNextRun(CronUtil.nextRun(scheduledJobEntity.getCronExpression(), this.now()));
        this.scheduledJobService.addScheduledJob(scheduledJobEntity);
        log.info("scheduled job created. scheduledJobId:{}, name:{}, cron:{}, nextRun:{}",
                scheduledJobEntity.getScheduledJobId(),
                scheduledJobEntity.getJobName(),
                scheduledJobEntity.getCronExpression(),
                scheduledJobEntity.getNextRun());
        return scheduledJobEntity;
    }

    public ScheduledJobEntity updateJob(long scheduledJobId, UpdateScheduledJobRequest updateScheduledJobRequest)
            throws ValidationException, ResourceNotFoundException, DbException {
        EntityValidationUtil.isUpdateScheduledJobRequestValid(updateScheduledJobRequest);
        ScheduledJobEntity scheduledJobEntity = this.getJob(scheduledJobId);
        if (ObjectUtils.isNotEmpty(updateScheduledJobRequest.getName())) {
            scheduledJobEntity.setJobName(updateScheduledJobRequest.getName().trim());
        }
        // 空字符串表示清空
        if (updateScheduledJobRequest.getRepository() != null) {
            scheduledJobEntity.setRepository(StringUtils.trimToNull(updateScheduledJobRequest.getRepository()));
        }
        if (updateScheduledJobRequest.getConfigFile() != null) {
            scheduledJobEntity.setConfigFile(StringUtils.trimToNull(updateScheduledJobRequest.getConfigFile()));
        }
        if (ObjectUtils.isNotEmpty(updateScheduledJobRequest.getDescription())) {
            scheduledJobEntity.setDescription(updateScheduledJobRequest.getDescription());
        }
        boolean recompute = false;
        if (StringUtils.isNotBlank(updateScheduledJobRequest.getCronExpression())) {
            scheduledJobEntity.setCronExpression(updateScheduledJobRequest.getCronExpression().trim());
            recompute = true;
        }
        if (ObjectUtils.isNotEmpty(updateScheduledJobRequest.getEnabled())) {
            boolean wasEnabled = Boolean.TRUE.equals(scheduledJobEntity.getEnabled());
            scheduledJobEntity.setEnabled(updateScheduledJobRequest.getEnabled());
            recompute = recompute || (!wasEnabled && updateScheduledJobRequest.getEnabled());
        }
        // 从当前时间重新计算, 不从旧的 next run 推
        if (recompute) {
            scheduledJobEntity.setNextRun(CronUtil.nextRun(scheduledJobEntity.getCronExpression(), this.now()));
        }
        this.scheduledJobService.updateScheduledJob(scheduledJobEntity, recompute);
        log.info("scheduled job updated. scheduledJobId:{}, cron:{}, enabled:{}, nextRun:{}",
                scheduledJobId,
                scheduledJobEntity.getCronExpression(),
                scheduledJobEntity.getEnabled(),
                scheduledJobEntity.getNextRun());
        return scheduledJobEntity;
    }

    public void deleteJob(long scheduledJobId) throws ResourceNotFoundException, DbException {
        ScheduledJobEntity scheduledJobEntity = this.getJob(scheduledJobId);
        this.scheduledJobService.deleteScheduledJob(scheduledJobEntity);
        log.info("scheduled job deleted. scheduledJobId:{}, name:{}", scheduledJobId, scheduledJobEntity.getJobName());
    }

    public ScheduledJobEntity toggleJob(long scheduledJobId) throws ResourceNotFoundException, DbException {
        ScheduledJobEntity scheduledJobEntity = this.getJob(scheduledJobId);
        boolean enable = !Boolean.TRUE.equals(scheduledJobEntity.getEnabled());
        scheduledJobEntity.setEnabled(enable);
        if (enable) {
            scheduledJobEntity.setNextRun(CronUtil.nextRun(scheduledJobEntity.getCronExpression(), this.now()));
        }
        this.scheduledJobService.updateScheduledJob(scheduledJobEntity, enable);
        log.info("scheduled job toggled. scheduledJobId:{}, enabled:{}, nextRun:{}",
                scheduledJobId, enable, scheduledJobEntity.getNextRun());
        return scheduledJobEntity;
    }

    /**
     * Runs a job immediately regardless of its schedule or enabled flag, with the same bookkeeping
     * as a scheduled run.
     */
    public BackupRunResult runNow(long scheduledJobId, String principal)
            throws ResourceNotFoundException, BusinessException {
        ScheduledJobEntity scheduledJobEntity = this.getJob(scheduledJobId);
        log.info("scheduled job run now. scheduledJobId:{}, principal:{}", scheduledJobId, principal);
        BackupRunResult backupRunResult = this.executeJob(scheduledJobEntity, BackupTriggerEnum.MANUAL, principal);
        if (ObjectUtils.isEmpty(backupRunResult)) {
            throw new BusinessException("runNow failed. backup run can't be recorded. scheduledJobId is %s"
                    .formatted(scheduledJobId));
        }
        return backupRunResult;
    }

    public ScheduledJobEntity getJob(long scheduledJobId) throws ResourceNotFoundException {
        ScheduledJobEntity scheduledJobEntity = this.scheduledJobService.getByScheduledJobId(scheduledJobId);
        if (ObjectUtils.isEmpty(scheduledJobEntity)) {
            throw new ResourceNotFoundException("getJob failed. scheduledJobId %s not found".formatted(scheduledJobId));
        }
        return scheduledJobEntity;
    }

    public List<ScheduledJobEntity> listJobs() {
        return this.scheduledJobService.getAllScheduledJob();
    }

    public List<LocalDateTime> getUpcomingRuns(ScheduledJobEntity scheduledJobEntity, int count) {
        if (!Boolean.TRUE.equals(scheduledJobEntity.getEnabled())) {
            return List.of();
        }
        return CronUtil.nextRuns(scheduledJobEntity.getCronExpression(), this.now(), count);
    }

    /**
     * Enabled jobs whose next run falls within the next {@code hours}, soonest first. Overdue jobs
     * are included.
     */
    public List<ScheduledJobEntity> getUpcomingJobs(int hours) throws ValidationException {
        if (hours < 1 || hours > 24 * 30) {
            throw new ValidationException("getUpcomingJobs failed. hours %s out of range [1, 720]".formatted(hours));
        }
        LocalDateTime horizon = this.now().plusHours(hours);
        return this.scheduledJobService.getAllScheduledJob().stream()
                .filter(job -> Boolean.TRUE.equals(job.getEnabled()))
                .filter(job -> ObjectUtils.isNotEmpty(job.getNextRun()))
                .filter(job -> !job.getNextRun().isAfter(horizon))
                .sorted(Comparator.comparing(ScheduledJobEntity::getNextRun))
                .toList();
    }

    public CronPreview previewCron(String cronExpression) {
        CronPreview cronPreview = new CronPreview();
        cronPreview.setCronExpression(cronExpression);
        try {
            for (LocalDateTime run : CronUtil.nextRuns(cronExpression, this.now(), PREVIEW_UPCOMING_RUNS)) {
                cronPreview.getNextRuns().add(run.toString());
            }
            cronPreview.setValid(true);
        } catch (ValidationException e) {
            cronPreview.setValid(false);
            cronPreview.setError(e.getMessage());
        }
        return cronPreview;
    }

    // fixDelay, 单位 millisecond
    @Scheduled(
            initialDelayString = "${archivist.server.scheduler.initial-delay-millis:10000}",
            fixedDelayString = "${archivist.server.scheduler.poll-interval-millis:60000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void pollDueJobs() {
        try {
            this.runDueJobs();
        } catch (RuntimeException e) {
            log.error("pollDueJobs failed. due job query failed.", e);
        }
    }

    /**
     * One polling pass.
     *
     * @return number of due jobs that were picked up
     */
    public int runDueJobs() throws DbException {
        LocalDateTime now = this.now();
        List<ScheduledJobEntity> dueJobs = this.scheduledJobService.getDueJobs(now);
        if (CollectionUtils.isEmpty(dueJobs)) {
            log.debug("poll due jobs. nothing due at {}", now);
            return 0;
        }
        log.info("poll due jobs. {} due at {}", dueJobs.size(), now);
        int picked = 0;
        for (ScheduledJobEntity scheduledJobEntity : dueJobs) {
            // 查询之后被 disable 的 job 跳过
            if (ScheduledJobStateEnum.of(scheduledJobEntity, now) != ScheduledJobStateEnum.DUE) {
                continue;
            }
            picked++;
            try {
                this.executeJob(scheduledJobEntity, BackupTriggerEnum.SCHEDULED, null);
            } catch (RuntimeException e) {
                log.error("runDueJobs has error. scheduledJob:{}", scheduledJobEntity, e);
            }
        }
        return picked;
    }

    private BackupRunResult executeJob(
            ScheduledJobEntity scheduledJobEntity,
            BackupTriggerEnum backupTrigger,
            String principal) {
        long scheduledJobId = scheduledJobEntity.getScheduledJobId();
        BackupRunResult backupRunResult = null;
        String failure = null;
        try {
            backupRunResult = this.backupJobFacadeService.runBackup(
                    scheduledJobEntity.getRepository(),
                    scheduledJobEntity.getConfigFile(),
                    backupTrigger,
                    scheduledJobId,
                    principal);
            if (!backupRunResult.isSuccess()) {
                failure = StringUtils.defaultIfBlank(
                        backupRunResult.getCommandResult().getStderr(),
                        "exitCode " + backupRunResult.getCommandResult().getExitCode());
            }
        } catch (RuntimeException e) {
            log.error("executeJob failed. scheduledJobId:{}", scheduledJobId, e);
            failure = e.getMessage();
        }
        // 无论成功与否都记录 last run
        this.recordRunTimes(scheduledJobEntity);
        if (StringUtils.isEmpty(failure) && ObjectUtils.isNotEmpty(backupRunResult)) {
            log.info("scheduled job finished. scheduledJobId:{}, backupJobRunId:{}",
                    scheduledJobId, backupRunResult.getBackupJobRun().getBackupJobRunId());
        } else {
            log.warn("scheduled job failed. scheduledJobId:{}, error:{}",
                    scheduledJobId, StringUtils.abbreviate(failure, EVENT_MESSAGE_MAX_LENGTH));
        }
        this.publishOutcome(scheduledJobEntity, backupRunResult, failure, principal);
        return backupRunResult;
    }

    private void recordRunTimes(ScheduledJobEntity scheduledJobEntity) {
        LocalDateTime completedAt = this.now();
        LocalDateTime nextRun = null;
        try {
            nextRun = CronUtil.nextRun(scheduledJobEntity.getCronExpression(), completedAt);
        } catch (ValidationException e) {
            log.error("recordRunTimes. stored cron expression is invalid. scheduledJob:{}", scheduledJobEntity, e);
        }
        scheduledJobEntity.setLastRun(completedAt);
        scheduledJobEntity.setNextRun(nextRun);
        try {
            this.scheduledJobService.updateRunTimes(scheduledJobEntity.getScheduledJobId(), completedAt, nextRun);
        } catch (RuntimeException e) {
            log.error("recordRunTimes failed. scheduledJobId:{}", scheduledJobEntity.getScheduledJobId(), e);
        }
    }

    private void publishOutcome(
            ScheduledJobEntity scheduledJobEntity,
            BackupRunResult backupRunResult,
            String failure,
            String principal) {
        boolean success = StringUtils.isEmpty(failure) && ObjectUtils.isNotEmpty(backupRunResult);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", scheduledJobEntity.getScheduledJobId());
        data.put("job_name", scheduledJobEntity.getJobName());
        if (ObjectUtils.isNotEmpty(backupRunResult)) {
            data.put("run_id", backupRunResult.getBackupJobRun().getBackupJobRunId());
        }
        data.put("progress", success ? 100 : 0);
        data.put("status", success ?
                BackupJobStatusEnum.COMPLETED.getName() :
                BackupJobStatusEnum.FAILED.getName());
        data.put("message", success ?
                "Scheduled backup completed" :
                "Scheduled backup failed: " + StringUtils.abbreviate(
                        StringUtils.defaultString(failure), EVENT_MESSAGE_MAX_LENGTH));
        data.put("next_run", ObjectUtils.isEmpty(scheduledJobEntity.getNextRun()) ?
                null :
                scheduledJobEntity.getNextRun().toString());
        try {
            this.eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, data, StringUtils.trimToNull(principal));
        } catch (RuntimeException e) {
            log.error("publishOutcome failed. scheduledJobId:{}", scheduledJobEntity.getScheduledJobId(), e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(this.clock);
    }
}

package com.archivist.server.controller;

import com.archivist.server.enums.CronPresetEnum;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.backup.BackupRunInfo;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.api.global.RequestHeaders;
import com.archivist.server.model.api.schedule.CreateScheduledJobRequest;
import com.archivist.server.model.api.schedule.CronPreview;
import com.archivist.server.model.api.schedule.ScheduledJobInfo;
import com.archivist.server.model.api.schedule.UpdateScheduledJobRequest;
import com.archivist.server.model.api.schedule.ValidateCronRequest;
import com.archivist.server.model.entity.ScheduledJobEntity;
import com.archivist.server.model.internal.BackupRunResult;
import com.archivist.server.service.bussiness.JobSchedulerService;
import com.archivist.server.util.CronUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/schedule")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class ScheduleController {

    private final JobSchedulerService jobSchedulerService;

    private final Clock clock;

    @Autowired
    public ScheduleController(JobSchedulerService jobSchedulerService, Clock clock) {
        this.jobSchedulerService = jobSchedulerService;
        this.clock = clock;
    }

    @GetMapping("/get-all-jobs")
    public ArchivistHttpResponse<List<ScheduledJobInfo>> getAllJobs() {
        LocalDateTime now = LocalDateTime.now(this.clock);
        List<ScheduledJobInfo> result = this.jobSchedulerService.listJobs().stream()
                .map(job -> new ScheduledJobInfo(job, now))
                .toList();
        return ArchivistHttpResponse.success(result);
    }

    @GetMapping("/get-job")
    public ArchivistHttpResponse<ScheduledJobInfo> getJob(@RequestParam("scheduledJobId") long scheduledJobId) {
        ScheduledJobEntity scheduledJobEntity = this.jobSchedulerService.getJob(scheduledJobId);
        return ArchivistHttpResponse.success(new ScheduledJobInfo(
                scheduledJobEntity,
                LocalDateTime.now(this.clock),
                this.jobSchedulerService.getUpcomingRuns(
                        scheduledJobEntity, JobSchedulerService.DETAIL_UPCOMING_RUNS)));
    }

    @PostMapping("/create-job")
    public ArchivistHttpResponse<ScheduledJobInfo> createJob(
            @RequestBody CreateScheduledJobRequest createScheduledJobRequest) {
        ScheduledJobEntity scheduledJobEntity = this.jobSchedulerService.createJob(createScheduledJobRequest);
        return ArchivistHttpResponse.success(
                new ScheduledJobInfo(scheduledJobEntity, LocalDateTime.now(this.clock)),
                "Scheduled job created");
    }

    @PostMapping("/update-job")
    public ArchivistHttpResponse<ScheduledJobInfo> updateJob(
            @RequestParam("scheduledJobId") long scheduledJobId,
            @RequestBody UpdateScheduledJobRequest updateScheduledJobRequest) {
        ScheduledJobEntity scheduledJobEntity = this.jobSchedulerService.updateJob(
                scheduledJobId, updateScheduledJobRequest);
        return ArchivistHttpResponse.success(
                new ScheduledJobInfo(scheduledJobEntity, LocalDateTime.now(this.clock)),
                "Scheduled job updated");
    }

    @PostMapping("/delete-job")
    public ArchivistHttpResponse<Void> deleteJob(@RequestParam("scheduledJobId") long scheduledJobId) {
        this.jobSchedulerService.deleteJob(scheduledJobId);
        return ArchivistHttpResponse.success(null, "Scheduled job deleted");
    }

    @PostMapping("/toggle-job")
    public ArchivistHttpResponse<ScheduledJobInfo> toggleJob(@RequestParam("scheduledJobId") long scheduledJobId) {
        ScheduledJobEntity scheduledJobEntity = this.jobSchedulerService.toggleJob(scheduledJobId);
        return ArchivistHttpResponse.success(
                new ScheduledJobInfo(scheduledJobEntity, LocalDateTime.now(this.clock)),
                Boolean.TRUE.equals(scheduledJobEntity.getEnabled()) ? "Job enabled" : "Job disabled");
    }

    @PostMapping("/run-job-now")
    public ArchivistHttpResponse<BackupRunInfo> runJobNow(
            @RequestHeader(RequestHeaders.USER) String principal,
            @RequestParam("scheduledJobId") long scheduledJobId) {
        BackupRunResult backupRunResult = this.jobSchedulerService.runNow(scheduledJobId, principal);
        return ArchivistHttpResponse.success(
                new BackupRunInfo(backupRunResult.getBackupJobRun()),
                backupRunResult.isSuccess() ? "Job executed successfully" : "Job execution failed");
    }

    @PostMapping("/validate-cron")
    public ArchivistHttpResponse<CronPreview> validateCron(@RequestBody ValidateCronRequest validateCronRequest) {
        String expression;
        try {
            expression = CronUtil.compose(
                    validateCronRequest.getMinute(),
                    validateCronRequest.getHour(),
                    validateCronRequest.getDayOfMonth(),
                    validateCronRequest.getMonth(),
                    validateCronRequest.getDayOfWeek());
        } catch (ValidationException e) {
            CronPreview cronPreview = new CronPreview();
            cronPreview.setValid(false);
            cronPreview.setError(e.getMessage());
            return ArchivistHttpResponse.success(cronPreview);
        }
        return ArchivistHttpResponse.success(this.jobSchedulerService.previewCron(expression));
    }

    @GetMapping("/get-cron-presets")
    public ArchivistHttpResponse<List<Map<String, String>>> getCronPresets() {
        List<Map<String, String>> result = Arrays.stream(CronPresetEnum.values())
                .map(preset -> {
                    Map<String, String> item = new LinkedHashMap<>();
                    item.put("name", preset.getDisplayName());
                    item.put("expression", preset.getExpression());
                    item.put("description", preset.getDescription());
                    return item;
                })
                .toList();
        return ArchivistHttpResponse.success(result);
    }

    @GetMapping("/get-upcoming-jobs")
    public ArchivistHttpResponse<List<ScheduledJobInfo>> getUpcomingJobs(
            @RequestParam(value = "hours", defaultValue = "24") int hours) {
        LocalDateTime now = LocalDateTime.now(this.clock);
        List<ScheduledJobInfo> result = this.jobSchedulerService.getUpcomingJobs(hours).stream()
                .map(job -> new ScheduledJobInfo(job, now))
                .toList();
        return ArchivistHttpResponse.success(result);
    }
}

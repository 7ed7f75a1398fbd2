package com.archivist.server.model.api.schedule;

import com.archivist.server.enums.ScheduledJobStateEnum;
import com.archivist.server.model.entity.ScheduledJobEntity;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class ScheduledJobInfo {

    private String scheduledJobId;

    private String name;

    private String cronExpression;

    private String repository;

    private String configFile;

    private boolean enabled;

    // disabled / armed / due
    private String state;

    private String lastRun = "";

    private String nextRun = "";

    private String description;

    private List<String> upcomingRuns = new ArrayList<>();

    public ScheduledJobInfo(ScheduledJobEntity scheduledJobEntity, LocalDateTime now) {
        this.scheduledJobId = scheduledJobEntity.getScheduledJobId().toString();
        this.name = scheduledJobEntity.getJobName();
        this.cronExpression = scheduledJobEntity.getCronExpression();
        this.repository = scheduledJobEntity.getRepository();
        this.configFile = scheduledJobEntity.getConfigFile();
        this.enabled = Boolean.TRUE.equals(scheduledJobEntity.getEnabled());
        this.state = ScheduledJobStateEnum.of(scheduledJobEntity, now).name().toLowerCase();
        if (ObjectUtils.isNotEmpty(scheduledJobEntity.getLastRun())) {
            this.lastRun = scheduledJobEntity.getLastRun().toString();
        }
        if (ObjectUtils.isNotEmpty(scheduledJobEntity.getNextRun())) {
            this.nextRun = scheduledJobEntity.getNextRun().toString();
        }
        this.description = scheduledJobEntity.getDescription();
    }

    public ScheduledJobInfo(ScheduledJobEntity scheduledJobEntity, LocalDateTime now, List<LocalDateTime> upcoming) {
        this(scheduledJobEntity, now);
        for (LocalDateTime run : upcoming) {
            this.upcomingRuns.add(run.toString());
        }
    }
}

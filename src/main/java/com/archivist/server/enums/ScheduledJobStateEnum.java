package com.archivist.server.enums;

import com.archivist.server.model.entity.ScheduledJobEntity;
import org.apache.commons.lang3.ObjectUtils;

import java.time.LocalDateTime;

public enum ScheduledJobStateEnum {

    // enabled = false, 不参与调度
    DISABLED,

    // enabled = true, next run 在未来
    ARMED,

    // enabled = true, next run <= now
    DUE
    ;

    public static ScheduledJobStateEnum of(ScheduledJobEntity scheduledJobEntity, LocalDateTime now) {
        if (!Boolean.TRUE.equals(scheduledJobEntity.getEnabled())) {
            return DISABLED;
        }
        LocalDateTime nextRun = scheduledJobEntity.getNextRun();
        if (ObjectUtils.isNotEmpty(nextRun) && !nextRun.isAfter(now)) {
            return DUE;
        }
        return ARMED;
    }
}

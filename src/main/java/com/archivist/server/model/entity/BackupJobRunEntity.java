package com.archivist.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("backup_job_run")
public class BackupJobRunEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long backupJobRunId;

    private String repository;

    // BackupJobStatusEnum name
    private String backupJobStatus;

    // 0 - 100
    private Integer progress;

    private String logs;

    private String errorMessage;

    // BackupTriggerEnum name
    private String backupTrigger;

    // 手动触发时为空
    private Long scheduledJobId;

    private String principal;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}

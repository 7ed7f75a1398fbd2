package com.archivist.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.annotation.FieldStrategy;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("scheduled_job")
public class ScheduledJobEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long scheduledJobId;

    private String jobName;

    // 5 段式: minute hour day-of-month month day-of-week
    private String cronExpression;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String repository;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String configFile;

    private Boolean enabled;

    private LocalDateTime lastRun;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private LocalDateTime nextRun;

    private String description;
}

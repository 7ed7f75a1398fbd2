package com.archivist.server.model.api.schedule;

import lombok.Data;

// 为 null 的字段不修改
@Data
public class UpdateScheduledJobRequest {

    private String name;

    private String cronExpression;

    private String repository;

    private String configFile;

    private Boolean enabled;

    private String description;
}

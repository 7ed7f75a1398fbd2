package com.archivist.server.model.api.schedule;

import lombok.Data;

@Data
public class CreateScheduledJobRequest {

    private String name;

    private String cronExpression; // 5 段式

    private String repository;

    private String configFile;

    private Boolean enabled = true;

    private String description;
}

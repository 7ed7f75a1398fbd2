package com.archivist.server.model.api.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class BackupProgressRequest {

    @JsonProperty("job_id")
    private String jobId;

    private Integer progress;

    private String status;

    private String message;
}

package com.archivist.server.model.api.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class LogUpdateRequest {

    @JsonProperty("log_type")
    private String logType;

    @JsonProperty("log_data")
    private String logData;
}

package com.archivist.server.model.borgmatic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BorgRepository {

    private String id;

    private String location;

    @JsonProperty("last_modified")
    private String lastModified; // JSON 字段名: last_modified
}

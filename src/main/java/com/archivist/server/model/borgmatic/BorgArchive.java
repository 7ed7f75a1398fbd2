package com.archivist.server.model.borgmatic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BorgArchive {

    /**
     * Archive name, unique inside one repository
     */
    private String name;

    private String archive;

    private String id;

    /**
     * Local time the archive was started, e.g. 2024-01-15T10:30:00.000000
     */
    private String start;

    private String time;

    public String getDisplayName() {
        return this.name != null ? this.name : this.archive;
    }

    public String getCreatedAt() {
        return this.time != null ? this.time : this.start;
    }
}

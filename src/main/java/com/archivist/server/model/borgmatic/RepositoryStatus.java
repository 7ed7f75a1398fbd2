package com.archivist.server.model.borgmatic;

import com.archivist.server.enums.RepositoryHealthEnum;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class RepositoryStatus {

    private String repository;

    // healthy / error / unknown
    private String status;

    @JsonProperty("archive_count")
    private int archiveCount;

    @JsonProperty("last_backup")
    private String lastBackup;

    private String error;

    @JsonProperty("backup_running")
    private boolean backupRunning;

    public static RepositoryStatus healthy(String repository, int archiveCount, String lastBackup) {
        RepositoryStatus result = new RepositoryStatus();
        result.repository = repository;
        result.status = RepositoryHealthEnum.HEALTHY.getName();
        result.archiveCount = archiveCount;
        result.lastBackup = lastBackup;
        return result;
    }

    public static RepositoryStatus error(String repository, String error) {
        RepositoryStatus result = new RepositoryStatus();
        result.repository = repository;
        result.status = RepositoryHealthEnum.ERROR.getName();
        result.error = error;
        return result;
    }
}

package com.archivist.server.model.api.backup;

import lombok.Data;

@Data
public class CancelBackupRequest {

    private Long backupJobRunId;
}

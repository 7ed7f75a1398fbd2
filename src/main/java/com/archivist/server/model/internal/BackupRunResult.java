package com.archivist.server.model.internal;

import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.model.exec.CommandResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

// 一次 backup 的记录和命令结果
@Getter
@ToString
@AllArgsConstructor
public class BackupRunResult {

    private final BackupJobRunEntity backupJobRun;

    private final CommandResult commandResult;

    public boolean isSuccess() {
        return this.commandResult.isSuccess();
    }
}

package com.archivist.server.controller;

import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.backup.BackupRunInfo;
import com.archivist.server.model.api.backup.CancelBackupRequest;
import com.archivist.server.model.api.backup.StartBackupRequest;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.api.global.RequestHeaders;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.service.bussiness.BackupJobFacadeService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/backup")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class BackupController {

    private final BackupJobFacadeService backupJobFacadeService;

    @Autowired
    public BackupController(BackupJobFacadeService backupJobFacadeService) {
        this.backupJobFacadeService = backupJobFacadeService;
    }

    @PostMapping("/start-backup")
    public ArchivistHttpResponse<BackupRunInfo> startBackup(
            @RequestHeader(RequestHeaders.USER) String principal,
            @RequestBody StartBackupRequest startBackupRequest) {
        BackupJobRunEntity backupJobRun = this.backupJobFacadeService.startBackup(
                startBackupRequest.getRepository(),
                startBackupRequest.getConfigFile(),
                principal);
        return ArchivistHttpResponse.success(new BackupRunInfo(backupJobRun), "Backup started");
    }

    @GetMapping("/get-backup-status")
    public ArchivistHttpResponse<BackupRunInfo> getBackupStatus(
            @RequestParam("backupJobRunId") long backupJobRunId) {
        return ArchivistHttpResponse.success(new BackupRunInfo(this.backupJobFacadeService.getRun(backupJobRunId)));
    }

    @PostMapping("/cancel-backup")
    public ArchivistHttpResponse<BackupRunInfo> cancelBackup(@RequestBody CancelBackupRequest cancelBackupRequest) {
        if (ObjectUtils.isEmpty(cancelBackupRequest.getBackupJobRunId())) {
            throw new ValidationException("cancelBackup failed. backupJobRunId is null");
        }
        BackupJobRunEntity backupJobRun = this.backupJobFacadeService.cancel(cancelBackupRequest.getBackupJobRunId());
        // 只修改记录, 进程会继续运行到结束或超时
        return ArchivistHttpResponse.success(new BackupRunInfo(backupJobRun), "Backup marked as cancelled");
    }

    @GetMapping("/get-backup-logs")
    public ArchivistHttpResponse<Map<String, Object>> getBackupLogs(
            @RequestParam("backupJobRunId") long backupJobRunId) {
        BackupJobRunEntity backupJobRun = this.backupJobFacadeService.getRun(backupJobRunId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("backupJobRunId", backupJobRun.getBackupJobRunId().toString());
        result.put("status", backupJobRun.getBackupJobStatus());
        result.put("logs", this.backupJobFacadeService.getRunLogs(backupJobRunId));
        result.put("errorMessage", backupJobRun.getErrorMessage());
        return ArchivistHttpResponse.success(result);
    }

    @GetMapping("/get-recent-runs")
    public ArchivistHttpResponse<List<BackupRunInfo>> getRecentRuns(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        List<BackupRunInfo> result = this.backupJobFacadeService.listRecentRuns(limit).stream()
                .map(BackupRunInfo::new)
                .toList();
        return ArchivistHttpResponse.success(result);
    }
}

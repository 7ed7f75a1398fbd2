package com.archivist.server.controller;

import com.archivist.server.configuration.GlobalControllerAdvice;
import com.archivist.server.enums.BackupJobStatusEnum;
import com.archivist.server.enums.BackupTriggerEnum;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.entity.BackupJobRunEntity;
import com.archivist.server.service.bussiness.BackupJobFacadeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class BackupControllerTest {

    private BackupJobFacadeService backupJobFacadeService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        backupJobFacadeService = mock(BackupJobFacadeService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new BackupController(backupJobFacadeService))
                .setControllerAdvice(new GlobalControllerAdvice())
                .build();
    }

    private static BackupJobRunEntity run(BackupJobStatusEnum status) {
        BackupJobRunEntity entity = new BackupJobRunEntity();
        entity.setBackupJobRunId(11L);
        entity.setRepository("repo-a");
        entity.setBackupJobStatus(status.getName());
        entity.setProgress(0);
        entity.setBackupTrigger(BackupTriggerEnum.MANUAL.name());
        entity.setStartedAt(LocalDateTime.of(2024, 5, 1, 12, 0));
        return entity;
    }

    @Test
    void startBackupPassesCaller() throws Exception {
        when(backupJobFacadeService.startBackup("repo-a", null, "alice")).thenReturn(run(BackupJobStatusEnum.RUNNING));

        mockMvc.perform(post("/backup/start-backup")
                        .header("X-Archivist-User", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repository\":\"repo-a\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Backup started"))
                .andExpect(jsonPath("$.data.backupJobRunId").value("11"))
                .andExpect(jsonPath("$.data.status").value("running"))
                .andExpect(jsonPath("$.data.startedAt").value("2024-05-01T12:00"));
    }

    @Test
    void busyRepositoryIsBadRequest() throws Exception {
        when(backupJobFacadeService.startBackup("repo-a", null, "alice"))
                .thenThrow(new ValidationException("startBackup failed. backup already running for repository repo-a"));

        mockMvc.perform(post("/backup/start-backup")
                        .header("X-Archivist-User", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repository\":\"repo-a\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancelWithoutIdIsRejected() throws Exception {
        mockMvc.perform(post("/backup/cancel-backup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(backupJobFacadeService, never()).cancel(anyLong());
    }

    @Test
    void cancelReturnsCancelledRun() throws Exception {
        when(backupJobFacadeService.cancel(11L)).thenReturn(run(BackupJobStatusEnum.CANCELLED));

        mockMvc.perform(post("/backup/cancel-backup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"backupJobRunId\":11}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("cancelled"));
    }

    @Test
    void logsOfRun() throws Exception {
        BackupJobRunEntity failed = run(BackupJobStatusEnum.FAILED);
        failed.setErrorMessage("Repository locked");
        when(backupJobFacadeService.getRun(11L)).thenReturn(failed);
        when(backupJobFacadeService.getRunLogs(11L)).thenReturn("creating archive");

        mockMvc.perform(get("/backup/get-backup-logs").param("backupJobRunId", "11"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.logs").value("creating archive"))
                .andExpect(jsonPath("$.data.errorMessage").value("Repository locked"));
    }
}

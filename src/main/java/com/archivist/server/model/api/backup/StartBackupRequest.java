package com.archivist.server.model.api.backup;

import lombok.Data;

@Data
public class StartBackupRequest {

    private String repository; // 为空则使用配置文件中的全部 repository

    private String configFile;
}

package com.archivist.server.model.api.archive;

import com.archivist.server.model.borgmatic.RetentionPolicy;
import lombok.Data;

@Data
public class PruneArchivesRequest {

    private String repository;

    // 为空则使用默认保留策略
    private RetentionPolicy retention;
}

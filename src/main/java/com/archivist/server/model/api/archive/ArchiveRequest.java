package com.archivist.server.model.api.archive;

import lombok.Data;

@Data
public class ArchiveRequest {

    private String repository;

    private String archive;
}

package com.archivist.server.model.api.archive;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ExtractArchiveRequest {

    private String repository;

    private String archive;

    private List<String> paths = new ArrayList<>();

    private String destination;

    private boolean dryRun;
}

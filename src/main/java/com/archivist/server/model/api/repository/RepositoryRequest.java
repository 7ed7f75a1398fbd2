package com.archivist.server.model.api.repository;

import lombok.Data;

@Data
public class RepositoryRequest {

    private String repository;
}

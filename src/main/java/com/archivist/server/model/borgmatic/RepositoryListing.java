package com.archivist.server.model.borgmatic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

// borgmatic list --json 的一个元素, 每个 repository 一个
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepositoryListing {

    private List<BorgArchive> archives = new ArrayList<>();

    private BorgRepository repository;
}

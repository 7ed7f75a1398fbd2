package com.archivist.server.model.api.schedule;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CronPreview {

    private String cronExpression;

    private boolean valid;

    private String error;

    private List<String> nextRuns = new ArrayList<>();
}

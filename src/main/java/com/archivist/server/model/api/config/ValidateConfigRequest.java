package com.archivist.server.model.api.config;

import lombok.Data;

@Data
public class ValidateConfigRequest {

    private String content; // yaml 原文
}

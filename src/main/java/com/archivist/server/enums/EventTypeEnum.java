package com.archivist.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum EventTypeEnum {

    BACKUP_PROGRESS("backup_progress"),

    SYSTEM_STATUS("system_status"),

    LOG_UPDATE("log_update"),

    CONNECTION_ESTABLISHED("connection_established")
    ;

    private final String type;
}

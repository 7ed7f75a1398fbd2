package com.archivist.server.enums;

public enum BackupTriggerEnum {

    MANUAL,

    SCHEDULED
}

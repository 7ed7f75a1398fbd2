package com.archivist.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum RepositoryHealthEnum {

    HEALTHY("healthy"),

    ERROR("error"),

    UNKNOWN("unknown")
    ;

    private final String name;
}

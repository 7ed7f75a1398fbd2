package com.archivist.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DeletedEnum {

    NOT_DELETED(0),

    DELETED(1)
    ;

    private final int code;
}

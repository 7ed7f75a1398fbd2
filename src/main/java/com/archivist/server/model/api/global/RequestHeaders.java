package com.archivist.server.model.api.global;

public class RequestHeaders {

    // 由外部认证层写入, 作为 EventBus 的 subscriber id
    public static final String USER = "X-Archivist-User";

    private RequestHeaders() {}
}

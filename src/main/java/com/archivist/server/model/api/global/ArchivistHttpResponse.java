package com.archivist.server.model.api.global;

import com.archivist.server.exception.ArchivistException;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class ArchivistHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private ArchivistHttpResponse() {}

    public static <T> ArchivistHttpResponse<T> success(T data, String message) {
        ArchivistHttpResponse<T> result = new ArchivistHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> ArchivistHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static ArchivistHttpResponse<Void> success() {
        return success(null);
    }

    public static ArchivistHttpResponse<Void> fail(ArchivistException e) {
        ArchivistHttpResponse<Void> result = new ArchivistHttpResponse<>();
        // fall back 方法
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getArchivistMessage();
        return result;
    }
}

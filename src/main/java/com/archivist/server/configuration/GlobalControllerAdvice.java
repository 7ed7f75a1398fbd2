package com.archivist.server.configuration;

import com.archivist.server.exception.ArchivistException;
import com.archivist.server.exception.BusinessException;
import com.archivist.server.exception.DbException;
import com.archivist.server.exception.JsonException;
import com.archivist.server.exception.ResourceNotFoundException;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.baomidou.mybatisplus.core.exceptions.MybatisPlusException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponse(ArchivistHttpResponse.fail(e));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponse(ArchivistHttpResponse.fail(e));
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(ArchivistHttpResponse.fail(e));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponse(ArchivistHttpResponse.fail(e));
    }

    @ExceptionHandler(MybatisPlusException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleDBException(MybatisPlusException e) {
        log.warn("controller failed. db error happen.", e);
        return toResponse(ArchivistHttpResponse.fail(new DbException("db error.", e)));
    }

    @ExceptionHandler(ArchivistException.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleArchivistException(ArchivistException e) {
        log.warn("controller failed. ArchivistException happen", e);
        return toResponse(ArchivistHttpResponse.fail(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ArchivistHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(ArchivistHttpResponse.fail(
                new ArchivistException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString())));
    }

    private static ResponseEntity<ArchivistHttpResponse<Void>> toResponse(ArchivistHttpResponse<Void> response) {
        return ResponseEntity.status(response.getStatusCode()).body(response);
    }
}

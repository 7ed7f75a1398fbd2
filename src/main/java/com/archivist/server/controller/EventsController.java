package com.archivist.server.controller;

import com.archivist.server.bus.EventBus;
import com.archivist.server.bus.EventStream;
import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.events.BackupProgressRequest;
import com.archivist.server.model.api.events.LogUpdateRequest;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.api.global.RequestHeaders;
import com.archivist.server.service.borgmatic.BorgmaticService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/events")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class EventsController {

    private final EventBus eventBus;

    private final BorgmaticService borgmaticService;

    private final Clock clock;

    @Autowired
    public EventsController(EventBus eventBus, BorgmaticService borgmaticService, Clock clock) {
        this.eventBus = eventBus;
        this.borgmaticService = borgmaticService;
        this.clock = clock;
    }

    /**
     * Server-sent events for the calling user. Opening a second stream with the same identity
     * replaces the first one.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<StreamingResponseBody> stream(@RequestHeader(RequestHeaders.USER) String principal) {
        EventStream eventStream = this.eventBus.openStream(principal);
        StreamingResponseBody body = outputStream -> {
            try (eventStream) {
                while (eventStream.isOpen()) {
                    outputStream.write(eventStream.next().getBytes(StandardCharsets.UTF_8));
                    outputStream.flush();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("event stream interrupted. subscriberId:{}", principal);
            } catch (IOException e) {
                // 客户端断开
                log.info("event stream closed by client. subscriberId:{}, reason:{}", principal, e.toString());
            }
        };
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header("X-Accel-Buffering", "no")
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(body);
    }

    // 只发给调用者自己
    @PostMapping("/send-backup-progress")
    public ArchivistHttpResponse<Map<String, Object>> sendBackupProgress(
            @RequestHeader(RequestHeaders.USER) String principal,
            @RequestBody BackupProgressRequest backupProgressRequest) {
        if (StringUtils.isAnyBlank(backupProgressRequest.getJobId(), backupProgressRequest.getStatus())) {
            throw new ValidationException("sendBackupProgress failed. job_id or status is null");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", backupProgressRequest.getJobId());
        data.put("progress", ObjectUtils.defaultIfNull(backupProgressRequest.getProgress(), 0));
        data.put("status", backupProgressRequest.getStatus());
        data.put("message", StringUtils.defaultString(backupProgressRequest.getMessage()));
        int delivered = this.eventBus.publish(EventTypeEnum.BACKUP_PROGRESS, data, principal);
        return ArchivistHttpResponse.success(Map.of("delivered", delivered));
    }

    @PostMapping("/send-system-status")
    public ArchivistHttpResponse<Map<String, Object>> sendSystemStatus() {
        int delivered = this.eventBus.publish(
                EventTypeEnum.SYSTEM_STATUS, this.borgmaticService.getSystemInfo().toEventData());
        return ArchivistHttpResponse.success(Map.of("delivered", delivered));
    }

    @PostMapping("/send-log-update")
    public ArchivistHttpResponse<Map<String, Object>> sendLogUpdate(@RequestBody LogUpdateRequest logUpdateRequest) {
        if (StringUtils.isBlank(logUpdateRequest.getLogType())) {
            throw new ValidationException("sendLogUpdate failed. log_type is null");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("log_type", logUpdateRequest.getLogType());
        data.put("log_data", StringUtils.defaultString(logUpdateRequest.getLogData()));
        data.put("timestamp", this.clock.instant().toString());
        int delivered = this.eventBus.publish(EventTypeEnum.LOG_UPDATE, data);
        return ArchivistHttpResponse.success(Map.of("delivered", delivered));
    }

    @GetMapping("/get-connections")
    public ArchivistHttpResponse<Map<String, Object>> getConnections() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("active_connections", this.eventBus.getSubscriberCount());
        result.put("subscribers", this.eventBus.getSubscriberIds());
        return ArchivistHttpResponse.success(result);
    }
}

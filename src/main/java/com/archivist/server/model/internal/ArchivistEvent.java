package com.archivist.server.model.internal;

import lombok.Getter;
import lombok.ToString;
import org.apache.commons.collections4.MapUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ToString
public class ArchivistEvent {

    private final String type;

    private final Map<String, Object> data;

    private final Instant timestamp;

    public ArchivistEvent(String type, Map<String, Object> data, Instant timestamp) {
        this.type = type;
        this.data = MapUtils.isEmpty(data) ?
                Collections.emptyMap() :
                Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.timestamp = timestamp;
    }

    // SSE 输出的结构: {"type": .., "data": {..}, "timestamp": ..}
    public Map<String, Object> toMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", this.type);
        message.put("data", this.data);
        message.put("timestamp", this.timestamp.toString());
        return message;
    }
}

package com.archivist.server.bus;

import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.model.internal.ArchivistEvent;
import com.archivist.server.util.JsonUtil;
import lombok.Getter;
import org.apache.commons.lang3.ObjectUtils;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Consumer side of one subscription, producing server-sent-event frames one at a time. The first
 * frame is always {@code connection_established}; afterwards each call waits at most the keepalive
 * window and yields either the next event or a keepalive comment.
 */
public class EventStream implements Closeable {

    public static final String KEEPALIVE_FRAME = ":\n\n";

    private final EventBus eventBus;

    @Getter
    private final Subscriber subscriber;

    private final Duration keepalive;

    private final Clock clock;

    private boolean established = false;

    EventStream(EventBus eventBus, Subscriber subscriber, Duration keepalive, Clock clock) {
        this.eventBus = eventBus;
        this.subscriber = subscriber;
        this.keepalive = keepalive;
        this.clock = clock;
    }

    public String next() throws InterruptedException {
        if (!this.established) {
            this.established = true;
            return format(new ArchivistEvent(
                    EventTypeEnum.CONNECTION_ESTABLISHED.getType(),
                    Map.of("message", "SSE connection established"),
                    this.clock.instant()));
        }
        ArchivistEvent event = this.subscriber.poll(this.keepalive);
        if (ObjectUtils.isEmpty(event)) {
            return KEEPALIVE_FRAME;
        }
        return format(event);
    }

    // 被 unsubscribe 或被同 id 的新连接替换后为 false
    public boolean isOpen() {
        return this.subscriber.isActive();
    }

    @Override
    public void close() {
        this.eventBus.unsubscribe(this.subscriber);
    }

    public static String format(ArchivistEvent event) {
        return "data: " + JsonUtil.serializeToString(event.toMessage()) + "\n\n";
    }
}

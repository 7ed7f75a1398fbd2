package com.archivist.server.bus;

import com.archivist.server.model.internal.ArchivistEvent;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live listener registered on the {@link EventBus}. The queue is bounded; when it is full the
 * oldest pending event is dropped so a publisher never blocks on a consumer that stopped draining.
 */
public class Subscriber {

    @Getter
    private final String subscriberId;

    private final LinkedBlockingDeque<ArchivistEvent> queue;

    private final AtomicBoolean active = new AtomicBoolean(true);

    private final AtomicLong droppedCount = new AtomicLong(0);

    Subscriber(String subscriberId, int queueCapacity) {
        this.subscriberId = subscriberId;
        this.queue = new LinkedBlockingDeque<>(Math.max(1, queueCapacity));
    }

    // 调用方持有 EventBus 的锁, 这里只做非阻塞入队
    boolean offer(ArchivistEvent event) {
        if (!this.active.get()) {
            return false;
        }
        while (!this.queue.offerLast(event)) {
            if (this.queue.pollFirst() != null) {
                this.droppedCount.incrementAndGet();
            }
        }
        return true;
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or null when the timeout elapsed first
     */
    public ArchivistEvent poll(Duration timeout) throws InterruptedException {
        return this.queue.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void close() {
        this.active.set(false);
        this.queue.clear();
    }

    public boolean isActive() {
        return this.active.get();
    }

    public int getPendingCount() {
        return this.queue.size();
    }

    public long getDroppedCount() {
        return this.droppedCount.get();
    }
}

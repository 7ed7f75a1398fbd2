package com.archivist.server.bus;

import com.archivist.server.enums.EventTypeEnum;
import com.archivist.server.exception.ValidationException;
import com.archivist.server.model.api.systeminfo.ArchivistSettings;
import com.archivist.server.model.internal.ArchivistEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of per-subscriber event queues. Every registry mutation and every broadcast iteration
 * happens under one lock; nothing inside the lock blocks or performs I/O.
 */
@Component
@Slf4j
public class EventBus {

    private final ReentrantLock registryLock = new ReentrantLock();

    // <subscriberId, subscriber>
    private final Map<String, Subscriber> subscriberMap = new HashMap<>();

    private final int queueCapacity;

    private final Duration keepalive;

    private final Clock clock;

    @Autowired
    public EventBus(ArchivistSettings archivistSettings, Clock clock) {
        this.queueCapacity = archivistSettings.getEvents().getQueueCapacity();
        this.keepalive = archivistSettings.getEvents().getKeepalive();
        this.clock = clock;
    }

    /**
     * Registers a fresh queue under {@code subscriberId}. A queue previously registered under the
     * same id is closed and its undelivered events are dropped.
     */
    public Subscriber subscribe(String subscriberId) throws ValidationException {
        if (StringUtils.isBlank(subscriberId)) {
            throw new ValidationException("subscribe failed. subscriberId is blank");
        }
        Subscriber subscriber = new Subscriber(subscriberId, this.queueCapacity);
        Subscriber previous;
        int total;
        this.registryLock.lock();
        try {
            previous = this.subscriberMap.put(subscriberId, subscriber);
            total = this.subscriberMap.size();
        } finally {
            this.registryLock.unlock();
        }
        if (ObjectUtils.isNotEmpty(previous)) {
            previous.close();
        }
        log.info("subscriber added. subscriberId:{}, replaced:{}, totalSubscribers:{}",
                subscriberId, previous != null, total);
        return subscriber;
    }

    public void unsubscribe(String subscriberId) {
        if (StringUtils.isBlank(subscriberId)) {
            return;
        }
        Subscriber removed;
        int total;
        this.registryLock.lock();
        try {
            removed = this.subscriberMap.remove(subscriberId);
            total = this.subscriberMap.size();
        } finally {
            this.registryLock.unlock();
        }
        if (ObjectUtils.isNotEmpty(removed)) {
            removed.close();
            log.info("subscriber removed. subscriberId:{}, totalSubscribers:{}", subscriberId, total);
        }
    }

    // 只移除仍然注册着的同一个 subscriber, 已被新连接替换的不动
    void unsubscribe(Subscriber subscriber) {
        boolean removed;
        this.registryLock.lock();
        try {
            removed = this.subscriberMap.remove(subscriber.getSubscriberId(), subscriber);
        } finally {
            this.registryLock.unlock();
        }
        subscriber.close();
        if (removed) {
            log.info("subscriber removed. subscriberId:{}", subscriber.getSubscriberId());
        }
    }

    public int publish(EventTypeEnum eventType, Map<String, Object> data) {
        return this.publish(eventType, data, null);
    }

    /**
     * Enqueues an event onto {@code targetSubscriberId}'s queue, or onto every registered queue
     * when the target is null. An unknown target is a no-op.
     *
     * @return number of queues the event was enqueued onto
     */
    public int publish(EventTypeEnum eventType, Map<String, Object> data, String targetSubscriberId) {
        if (ObjectUtils.isEmpty(eventType)) {
            throw new ValidationException("publish failed. eventType is null");
        }
        ArchivistEvent event = new ArchivistEvent(eventType.getType(), data, this.clock.instant());
        int delivered = 0;
        this.registryLock.lock();
        try {
            if (StringUtils.isNotBlank(targetSubscriberId)) {
                Subscriber subscriber = this.subscriberMap.get(targetSubscriberId);
                if (ObjectUtils.isNotEmpty(subscriber) && subscriber.offer(event)) {
                    delivered++;
                }
            } else {
                for (Subscriber subscriber : this.subscriberMap.values()) {
                    if (subscriber.offer(event)) {
                        delivered++;
                    }
                }
            }
        } finally {
            this.registryLock.unlock();
        }
        log.debug("event published. type:{}, target:{}, delivered:{}",
                eventType.getType(), targetSubscriberId, delivered);
        return delivered;
    }

    public EventStream openStream(String subscriberId) throws ValidationException {
        return new EventStream(this, this.subscribe(subscriberId), this.keepalive, this.clock);
    }

    public int getSubscriberCount() {
        this.registryLock.lock();
        try {
            return this.subscriberMap.size();
        } finally {
            this.registryLock.unlock();
        }
    }

    public List<String> getSubscriberIds() {
        this.registryLock.lock();
        try {
            return new ArrayList<>(this.subscriberMap.keySet());
        } finally {
            this.registryLock.unlock();
        }
    }

    public boolean isSubscribed(String subscriberId) {
        this.registryLock.lock();
        try {
            return this.subscriberMap.containsKey(subscriberId);
        } finally {
            this.registryLock.unlock();
        }
    }
}

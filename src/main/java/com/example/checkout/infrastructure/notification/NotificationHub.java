package com.example.checkout.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process pub/sub registry keyed by {@link TopicKey}.
 * <p>
 * Each subscriber owns a bounded buffer. When a slow subscriber's buffer is full the message is
 * dropped for that subscriber only; publishers never block.
 */
@Component
public class NotificationHub {

    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    private final ConcurrentHashMap<TopicKey, Set<Subscription>> topics = new ConcurrentHashMap<>();
    private final int bufferSize;

    public NotificationHub(@Value("${checkout.notification.buffer-size:256}") int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("checkout.notification.buffer-size must be positive");
        }
        this.bufferSize = bufferSize;
    }

    public Subscription subscribe(TopicKey key) {
        Subscription subscription = new Subscription(key,
                Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize)));
        // add inside compute so a concurrent close of the last subscriber cannot orphan the set
        topics.compute(key, (k, subscribers) -> {
            Set<Subscription> target = subscribers != null ? subscribers : new CopyOnWriteArraySet<>();
            target.add(subscription);
            return target;
        });
        log.debug("Subscribed to {} ({} subscriber(s))", key, subscriberCount(key));
        return subscription;
    }

    /**
     * @return number of subscribers the message was buffered for
     */
    public int publish(TopicKey key, NotificationMessage message) {
        Set<Subscription> subscribers = topics.get(key);
        if (subscribers == null || subscribers.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (Subscription subscription : subscribers) {
            if (subscription.offer(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int subscriberCount(TopicKey key) {
        Set<Subscription> subscribers = topics.get(key);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void remove(Subscription subscription) {
        topics.computeIfPresent(subscription.key, (key, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    /**
     * One subscriber's stream. Must be closed when the consumer goes away.
     */
    public final class Subscription implements AutoCloseable {

        private final TopicKey key;
        private final Sinks.Many<NotificationMessage> sink;

        private Subscription(TopicKey key, Sinks.Many<NotificationMessage> sink) {
            this.key = key;
            this.sink = sink;
        }

        public TopicKey key() {
            return key;
        }

        public Flux<NotificationMessage> messages() {
            return sink.asFlux();
        }

        private synchronized boolean offer(NotificationMessage message) {
            Sinks.EmitResult result = sink.tryEmitNext(message);
            if (result.isSuccess()) {
                return true;
            }
            if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                log.warn("Subscriber buffer full on {}, dropping {} message", key, message.type());
            } else {
                log.debug("Could not deliver {} on {}: {}", message.type(), key, result);
            }
            return false;
        }

        @Override
        public synchronized void close() {
            remove(this);
            sink.tryEmitComplete();
        }
    }
}

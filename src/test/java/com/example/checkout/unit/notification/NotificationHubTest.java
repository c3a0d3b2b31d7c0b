package com.example.checkout.unit.notification;

import com.example.checkout.infrastructure.notification.NotificationHub;
import com.example.checkout.infrastructure.notification.NotificationMessage;
import com.example.checkout.infrastructure.notification.TopicKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Notification Hub Tests")
class NotificationHubTest {

    private static NotificationMessage progress(String stage) {
        return NotificationMessage.checkoutProgress(UUID.randomUUID(), stage, null, null, Instant.now());
    }

    @Test
    @DisplayName("should_deliver_only_to_subscribers_of_topic - 只推送給同一主題的訂閱者")
    void should_deliver_only_to_subscribers_of_topic() {
        // Given
        NotificationHub hub = new NotificationHub(16);
        NotificationHub.Subscription orderA = hub.subscribe(TopicKey.order("a"));
        NotificationHub.Subscription orderB = hub.subscribe(TopicKey.order("b"));

        // When
        int delivered = hub.publish(TopicKey.order("a"), progress("validated"));

        // Then
        assertThat(delivered).isEqualTo(1);
        orderA.close();
        orderB.close();
        StepVerifier.create(orderA.messages())
                .assertNext(m -> assertThat(m.stage()).isEqualTo("validated"))
                .verifyComplete();
        StepVerifier.create(orderB.messages())
                .verifyComplete();
    }

    @Test
    @DisplayName("should_fan_out_to_every_subscriber - 同主題多個訂閱者皆收到")
    void should_fan_out_to_every_subscriber() {
        NotificationHub hub = new NotificationHub(16);
        TopicKey key = TopicKey.userOrders(UUID.randomUUID());
        NotificationHub.Subscription first = hub.subscribe(key);
        NotificationHub.Subscription second = hub.subscribe(key);

        assertThat(hub.publish(key, progress("order_created"))).isEqualTo(2);
        assertThat(hub.subscriberCount(key)).isEqualTo(2);

        first.close();
        second.close();
    }

    @Test
    @DisplayName("should_drop_messages_when_buffer_full - 緩衝區滿時丟棄訊息")
    void should_drop_messages_when_buffer_full() {
        // Given: a subscriber that never reads
        NotificationHub hub = new NotificationHub(2);
        TopicKey key = TopicKey.order("slow");
        NotificationHub.Subscription slow = hub.subscribe(key);

        // When
        int first = hub.publish(key, progress("1"));
        int second = hub.publish(key, progress("2"));
        int third = hub.publish(key, progress("3"));

        // Then: the third frame is dropped, the first two are kept in order
        assertThat(first + second).isEqualTo(2);
        assertThat(third).isZero();
        slow.close();
        StepVerifier.create(slow.messages())
                .assertNext(m -> assertThat(m.stage()).isEqualTo("1"))
                .assertNext(m -> assertThat(m.stage()).isEqualTo("2"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should_remove_topic_when_last_subscriber_closes - 最後一位訂閱者離開後移除主題")
    void should_remove_topic_when_last_subscriber_closes() {
        NotificationHub hub = new NotificationHub(4);
        TopicKey key = TopicKey.order("gone");
        NotificationHub.Subscription subscription = hub.subscribe(key);

        subscription.close();

        assertThat(hub.subscriberCount(key)).isZero();
        assertThat(hub.publish(key, progress("late"))).isZero();
    }

    @Test
    @DisplayName("should_keep_new_subscriber_when_last_one_closes_concurrently - 最後訂閱者離開時新訂閱者仍收到訊息")
    void should_keep_new_subscriber_when_last_one_closes_concurrently() throws Exception {
        NotificationHub hub = new NotificationHub(4);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 2000; round++) {
                // Given: one subscriber about to leave
                TopicKey key = TopicKey.order("race-" + round);
                NotificationHub.Subscription leaving = hub.subscribe(key);
                CyclicBarrier barrier = new CyclicBarrier(2);

                // When: it closes while another subscriber joins
                Future<?> closing = pool.submit(() -> {
                    barrier.await();
                    leaving.close();
                    return null;
                });
                Future<NotificationHub.Subscription> joining = pool.submit(() -> {
                    barrier.await();
                    return hub.subscribe(key);
                });
                closing.get(5, TimeUnit.SECONDS);
                NotificationHub.Subscription joined = joining.get(5, TimeUnit.SECONDS);

                // Then
                assertThat(hub.subscriberCount(key)).as("round %d", round).isEqualTo(1);
                assertThat(hub.publish(key, progress("after"))).as("round %d", round).isEqualTo(1);
                joined.close();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("should_reject_non_positive_buffer - 緩衝區大小必須為正")
    void should_reject_non_positive_buffer() {
        assertThatThrownBy(() -> new NotificationHub(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.example.checkout.infrastructure.adapter.in.websocket;

import com.example.checkout.infrastructure.notification.NotificationHub;
import com.example.checkout.infrastructure.notification.NotificationHub.Subscription;
import com.example.checkout.infrastructure.notification.NotificationMessage;
import com.example.checkout.infrastructure.notification.TopicKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared session loop for notification sockets.
 * <p>
 * The session is authorized first, then subscribed to its topic, then sent a snapshot, so no
 * update published after the snapshot was read can be missed. Client frames are answered in order.
 */
public abstract class AbstractNotificationSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractNotificationSocketHandler.class);

    static final String USER_HEADER = "X-User-Id";
    static final String USER_QUERY_PARAM = "userId";

    static final String INVALID_JSON = "Invalid JSON format";
    static final String UNKNOWN_TYPE = "Unknown message type";

    private final NotificationHub hub;
    private final ObjectMapper objectMapper;

    protected AbstractNotificationSocketHandler(NotificationHub hub, ObjectMapper objectMapper) {
        this.hub = hub;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolves the topic the caller may follow, or empty when the session must be refused.
     * May block; it runs on a bounded-elastic thread.
     */
    protected abstract Optional<TopicKey> authorize(UUID userId, String pathId);

    /**
     * Current state sent on connect and on a refresh request. May block.
     */
    protected abstract NotificationMessage snapshot(UUID userId, String pathId);

    /**
     * Client message type that asks for a fresh snapshot.
     */
    protected abstract String refreshType();

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        Optional<UUID> userId = resolveUser(handshake);
        String pathId = lastPathSegment(handshake.getUri());
        if (userId.isEmpty() || pathId.isEmpty()) {
            log.warn("Refusing unauthenticated socket on {}", handshake.getUri().getPath());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        return Mono.fromCallable(() -> authorize(userId.get(), pathId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(topic -> {
                    if (topic.isEmpty()) {
                        log.warn("Refusing socket for user {} on {}", userId.get(), handshake.getUri().getPath());
                        return session.close(CloseStatus.POLICY_VIOLATION);
                    }
                    return stream(session, topic.get(), userId.get(), pathId);
                });
    }

    private Mono<Void> stream(WebSocketSession session, TopicKey topic, UUID userId, String pathId) {
        Subscription subscription = hub.subscribe(topic);
        Sinks.One<Boolean> closed = Sinks.one();

        Flux<NotificationMessage> replies = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> reply(text, userId, pathId))
                .doFinally(signal -> closed.tryEmitValue(Boolean.TRUE));

        Flux<NotificationMessage> pushes = subscription.messages()
                .takeUntilOther(closed.asMono());

        Flux<WebSocketMessage> outbound = blockingSnapshot(userId, pathId)
                .concatWith(Flux.merge(replies, pushes))
                .map(message -> session.textMessage(toJson(message)));

        log.debug("Socket opened on {} for user {}", topic, userId);
        return session.send(outbound)
                .doFinally(signal -> {
                    subscription.close();
                    log.debug("Socket closed on {} ({})", topic, signal);
                });
    }

    private Mono<NotificationMessage> reply(String text, UUID userId, String pathId) {
        JsonNode request;
        try {
            request = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return Mono.just(NotificationMessage.error(INVALID_JSON));
        }
        String type = request.path("type").asText(null);
        if (refreshType().equals(type)) {
            return blockingSnapshot(userId, pathId);
        }
        return Mono.just(NotificationMessage.error(UNKNOWN_TYPE));
    }

    private Mono<NotificationMessage> blockingSnapshot(UUID userId, String pathId) {
        return Mono.fromCallable(() -> snapshot(userId, pathId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String toJson(NotificationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.type() + " message", e);
        }
    }

    static Optional<UUID> resolveUser(HandshakeInfo handshake) {
        String raw = handshake.getHeaders().getFirst(USER_HEADER);
        if (raw == null || raw.isBlank()) {
            raw = UriComponentsBuilder.fromUri(handshake.getUri()).build().getQueryParams().getFirst(USER_QUERY_PARAM);
        }
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static String lastPathSegment(URI uri) {
        String path = uri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}

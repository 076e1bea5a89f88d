package com.deepansh.pawsagent.session;

import com.deepansh.pawsagent.config.AgentProperties;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.model.SessionMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.Lifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis-backed session store, one JSON document per identity.
 *
 * Design decisions:
 * - Key pattern: wh:session:{normalizedIdentity}, delivery markers wh:seen:{messageId}
 * - Stored as a single JSON document (atomic read/write for a session)
 * - TTL reset on every append; idle sessions expire automatically
 * - Turn window: only the last N whole turns are kept (see {@link TurnTrimmer})
 *
 * Trade-off: append is read-modify-write without a lock. Two concurrent appends for
 * the same identity can interleave; neither write is torn, but one may reorder the
 * other's turn. Duplicate deliveries are stopped earlier by the delivery marker.
 */
@Component
@Slf4j
public class RedisSessionStore implements SessionStore {

    private static final String SEEN_VALUE = "1";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Session props;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public RedisSessionStore(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             AgentProperties agentProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.props = agentProperties.getSession();
    }

    @Override
    @PostConstruct
    public void connect() {
        if (!connected.compareAndSet(false, true)) {
            return;
        }
        if (isHealthy()) {
            log.info("Session store connected [ttl={}, maxTurns={}]", props.getTtl(), props.getMaxTurns());
        } else {
            // Lettuce reconnects on demand, loads fail soft until Redis is back
            log.warn("Session store could not reach Redis at start-up");
        }
    }

    @Override
    @PreDestroy
    public void disconnect() {
        if (!connected.compareAndSet(true, false)) {
            return;
        }
        RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
        if (factory instanceof Lifecycle) {
            ((Lifecycle) factory).stop();
        }
        log.info("Session store disconnected");
    }

    @Override
    public boolean isHealthy() {
        RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
        if (factory == null) return false;
        try (RedisConnection connection = factory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        } catch (Exception e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Load the session for an identity.
     * Returns empty if it doesn't exist, has expired, or cannot be read;
     * callers proceed as if the conversation were fresh.
     */
    @Override
    public Optional<Session> load(String identity) {
        String key = sessionKey(identity);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                log.debug("No session found for key: {}", key);
                return Optional.empty();
            }
            Session session = objectMapper.readValue(json, Session.class);
            if (session.getMessages() == null) {
                session.setMessages(new ArrayList<>());
            }
            log.debug("Loaded session {} with {} messages", key, session.getMessages().size());
            return Optional.of(session);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize session {}. Treating as fresh.", key, e);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Failed to load session {}. Treating as fresh: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Append one message and persist. Unlike {@link #load}, a failure here
     * propagates: the conversation must not silently lose a turn.
     */
    @Override
    public Session append(String identity, SessionMessage message) {
        String key = sessionKey(identity);
        Session session = load(identity).orElseGet(Session::fresh);

        List<SessionMessage> messages = new ArrayList<>(session.getMessages());
        messages.add(message);
        List<SessionMessage> windowed = TurnTrimmer.keepLastTurns(messages, props.getMaxTurns());
        if (windowed.size() < messages.size()) {
            log.debug("Trimmed session {}: {} → {} messages", key, messages.size(), windowed.size());
        }

        session.setStatus(Session.STATUS_ACTIVE);
        session.setMessages(windowed);
        session.setUpdatedAt(System.currentTimeMillis());

        try {
            String json = objectMapper.writeValueAsString(session);
            redisTemplate.opsForValue().set(key, json, props.getTtl());
        } catch (JsonProcessingException e) {
            throw new TransientExternalException("Failed to serialize session " + key, e);
        } catch (DataAccessException e) {
            throw new TransientExternalException("Failed to save session " + key, e);
        }

        log.debug("Saved session {} with {} messages (TTL: {})", key, windowed.size(), props.getTtl());
        return session;
    }

    @Override
    public void end(String identity) {
        String key = sessionKey(identity);
        try {
            redisTemplate.delete(key);
            log.info("Ended session {}", key);
        } catch (DataAccessException e) {
            throw new TransientExternalException("Failed to end session " + key, e);
        }
    }

    @Override
    public void touch(String identity) {
        String key = sessionKey(identity);
        try {
            redisTemplate.expire(key, props.getTtl());
        } catch (DataAccessException e) {
            throw new TransientExternalException("Failed to touch session " + key, e);
        }
    }

    @Override
    public boolean isSeen(String inboundMessageId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(seenKey(inboundMessageId)));
        } catch (DataAccessException e) {
            log.warn("Delivery marker lookup failed for {}: {}", inboundMessageId, e.getMessage());
            return false;
        }
    }

    /**
     * SET NX with the marker TTL. A store failure is logged and reported as a fresh
     * marker so the message is still processed.
     */
    @Override
    public boolean markSeen(String inboundMessageId) {
        Duration ttl = props.getSeenTtl();
        try {
            Boolean created = redisTemplate.opsForValue()
                    .setIfAbsent(seenKey(inboundMessageId), SEEN_VALUE, ttl);
            return !Boolean.FALSE.equals(created);
        } catch (DataAccessException e) {
            log.error("Failed to mark message {} as seen: {}", inboundMessageId, e.getMessage());
            return true;
        }
    }

    String sessionKey(String identity) {
        return props.getKeyPrefix() + IdentityNormalizer.normalize(identity);
    }

    String seenKey(String inboundMessageId) {
        return props.getSeenKeyPrefix() + inboundMessageId;
    }
}

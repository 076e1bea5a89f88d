package com.deepansh.pawsagent.tool.idempotency;

import com.deepansh.pawsagent.tool.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency shared by every replica.
 *
 * Key pattern: agent:idempotency:{idempotencyKey}
 * Value: JSON-serialized ToolResult, expires after the configured TTL.
 *
 * Redis failures degrade to "not cached": the tool runs again rather than the
 * conversation failing. Side-effecting tools still dedupe downstream (the records
 * service rejects a second registration).
 */
@Slf4j
public class RedisIdempotencyCache implements IdempotencyCache {

    static final String KEY_PREFIX = "agent:idempotency:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisIdempotencyCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<ToolResult> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(buildKey(key));
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Idempotency hit for key={}", key);
            return Optional.of(objectMapper.readValue(json, ToolResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Corrupt idempotency entry {}, ignoring: {}", key, e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Idempotency lookup failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, ToolResult result) {
        try {
            redisTemplate.opsForValue().set(buildKey(key), objectMapper.writeValueAsString(result), ttl);
            log.debug("Stored idempotency result for key={}", key);
        } catch (JsonProcessingException e) {
            log.warn("Tool result for {} is not serializable, not cached: {}", key, e.getMessage());
        } catch (DataAccessException e) {
            log.warn("Failed to store idempotency result for {}: {}", key, e.getMessage());
        }
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}

package com.deepansh.pawsagent.tool.idempotency;

import com.deepansh.pawsagent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the idempotency store from agent.tools.idempotency.store (memory | redis).
 */
@Configuration
@Slf4j
public class IdempotencyCacheConfig {

    @Bean
    @ConditionalOnProperty(name = "agent.tools.idempotency.store", havingValue = "memory", matchIfMissing = true)
    public IdempotencyCache inMemoryIdempotencyCache(AgentProperties properties) {
        int capacity = properties.getTools().getIdempotency().getCapacity();
        log.info("Tool idempotency: in-memory [capacity={}]", capacity);
        return new InMemoryIdempotencyCache(capacity);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.tools.idempotency.store", havingValue = "redis")
    public IdempotencyCache redisIdempotencyCache(StringRedisTemplate redisTemplate,
                                                  ObjectMapper objectMapper,
                                                  AgentProperties properties) {
        AgentProperties.Tools.Idempotency config = properties.getTools().getIdempotency();
        log.info("Tool idempotency: redis [ttl={}]", config.getTtl());
        return new RedisIdempotencyCache(redisTemplate, objectMapper, config.getTtl());
    }
}

package com.deepansh.pawsagent.tool;

import com.deepansh.pawsagent.session.IdentityNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Key pattern: {toolName}:{normalizedIdentity}:{messageKey}:{md5(canonical input)}
 *
 * Canonical input is JSON with map keys sorted at every depth, so two inputs that
 * differ only in key order share a key.
 */
@Component
public class IdempotencyKeyGenerator {

    private final ObjectMapper canonicalMapper;

    public IdempotencyKeyGenerator() {
        this.canonicalMapper = JsonMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
    }

    public String generate(String toolName, Object rawInput, ToolContext context) {
        String identity = context.identity() != null
                ? IdentityNormalizer.normalize(context.identity())
                : "anonymous";
        return toolName + ":" + identity + ":" + context.messageKey() + ":" + fingerprint(rawInput);
    }

    String fingerprint(Object rawInput) {
        String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(rawInput);
        } catch (JsonProcessingException e) {
            canonical = String.valueOf(rawInput);
        }
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }
}

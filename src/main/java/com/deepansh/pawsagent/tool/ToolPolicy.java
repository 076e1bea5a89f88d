package com.deepansh.pawsagent.tool;

import com.deepansh.pawsagent.config.AgentProperties;

import java.time.Duration;

/**
 * Execution limits for one tool. Any component may be null, meaning "use the default".
 */
public record ToolPolicy(Duration timeout, Integer retries, Duration retryDelay) {

    public static ToolPolicy of(Duration timeout, int retries, Duration retryDelay) {
        return new ToolPolicy(timeout, retries, retryDelay);
    }

    public static ToolPolicy defaults(AgentProperties.Tools tools) {
        return new ToolPolicy(tools.getTimeout(), tools.getRetries(), tools.getRetryDelay());
    }

    public ToolPolicy mergeWith(ToolPolicy defaults) {
        return new ToolPolicy(
                timeout != null ? timeout : defaults.timeout(),
                retries != null ? retries : defaults.retries(),
                retryDelay != null ? retryDelay : defaults.retryDelay());
    }

    public int attempts() {
        return retries + 1;
    }

    /** Wait before attempt {@code attempt + 1}: delay * 2^attempt */
    public Duration backoff(int attempt) {
        return retryDelay.multipliedBy(1L << attempt);
    }
}

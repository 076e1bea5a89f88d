package com.deepansh.pawsagent.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Central registry for all ToolHandler implementations.
 *
 * Spring auto-discovers every @Component that implements ToolHandler
 * and injects them as a List. We index them by name for O(1) dispatch.
 *
 * Handlers whose backing service is not configured report {@code isEnabled() == false}
 * and are invisible here: absent from the capability set and from {@link #find}.
 * Built once; read-only afterwards.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolHandler<?>> tools;

    public ToolRegistry(List<ToolHandler<?>> handlers) {
        Map<String, ToolHandler<?>> enabled = new LinkedHashMap<>();
        for (ToolHandler<?> handler : handlers) {
            if (!handler.isEnabled()) {
                log.info("Tool [{}] disabled — backing service not configured", handler.getName());
                continue;
            }
            ToolHandler<?> previous = enabled.put(handler.getName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + handler.getName());
            }
            log.info("Registered tool: [{}]", handler.getName());
        }
        this.tools = Map.copyOf(enabled);
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<ToolHandler<?>> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public List<ToolDefinition> getEnabledDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .collect(Collectors.toList());
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }
}

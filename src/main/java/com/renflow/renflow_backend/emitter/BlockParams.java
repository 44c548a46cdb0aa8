package com.renflow.renflow_backend.emitter;

import com.renflow.renflow_backend.model.domain.Block;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Read side of a block's loosely typed parameter map. Every getter tolerates missing keys,
 * null values and numbers stored where text is expected; none of them throws.
 */
public final class BlockParams {

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes");

    private final Map<String, Object> values;

    private BlockParams(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    public static BlockParams of(Block block) {
        return new BlockParams(block != null ? block.getParams() : null);
    }

    public static BlockParams of(Map<String, Object> values) {
        return new BlockParams(values);
    }

    /** Trimmed text of the first key (or alias) that holds a scalar value, "" when none does. */
    public String text(String key, String... aliases) {
        Object value = raw(key, aliases);
        if (value == null || value instanceof Map || value instanceof Collection) return "";
        return String.valueOf(value).trim();
    }

    public String textOrDefault(String key, String fallback) {
        String value = text(key);
        return value.isEmpty() ? fallback : value;
    }

    public boolean flag(String key, boolean fallback) {
        Object value = values.get(key);
        if (value instanceof Boolean b) return b;
        String text = text(key);
        if (text.isEmpty()) return fallback;
        return TRUTHY.contains(text.toLowerCase());
    }

    public Object raw(String key, String... aliases) {
        Object value = values.get(key);
        if (value != null) return value;
        for (String alias : aliases) {
            value = values.get(alias);
            if (value != null) return value;
        }
        return null;
    }
}

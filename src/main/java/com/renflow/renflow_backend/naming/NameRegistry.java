package com.renflow.renflow_backend.naming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw name -> generated identifier, built while definitions are collected and consulted by
 * every block that references one of those names.
 */
public class NameRegistry {

    private final Map<String, String> identifiers = new LinkedHashMap<>();

    public String register(String raw) {
        return identifiers.computeIfAbsent(key(raw), NameNormalizer::normalize);
    }

    public boolean contains(String raw) {
        return raw != null && identifiers.containsKey(key(raw));
    }

    // Names that were never registered still normalize the same way
    public String resolve(String raw) {
        String id = identifiers.get(key(raw));
        return id != null ? id : NameNormalizer.normalize(raw);
    }

    private static String key(String raw) {
        return raw == null ? "" : raw.trim();
    }
}

package com.renflow.renflow_backend.engine;

/**
 * Fixed text framing the generated script. Bound from configuration by {@code GeneratorConfig}.
 */
public record ScriptFormat(String headerTitle, String headerNotice, String entryLabel) {

    public static final String DEFAULT_HEADER_TITLE = "# Generated by RenPy Node Editor";
    public static final String DEFAULT_HEADER_NOTICE = "# This file is auto-generated. Do not edit manually.";
    public static final String DEFAULT_ENTRY_LABEL = "start";

    public static ScriptFormat defaults() {
        return new ScriptFormat(DEFAULT_HEADER_TITLE, DEFAULT_HEADER_NOTICE, DEFAULT_ENTRY_LABEL);
    }
}

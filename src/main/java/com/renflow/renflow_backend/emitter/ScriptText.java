package com.renflow.renflow_backend.emitter;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical helpers for the generated script: indentation, string escaping and literal formatting.
 */
public final class ScriptText {

    public static final String INDENT = "    ";

    public static final String PASS = "pass";

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private static final Set<String> PYTHON_CONSTANTS = Set.of("True", "False", "None");

    private ScriptText() {
    }

    public static String escapeDoubleQuoted(String text) {
        return text.replace("\"", "\\\"");
    }

    public static String escapeSingleQuoted(String text) {
        return text.replace("'", "\\'");
    }

    public static String quoted(String text) {
        return "\"" + escapeDoubleQuoted(text) + "\"";
    }

    public static boolean isNumber(String value) {
        return value != null && NUMBER.matcher(value).matches();
    }

    /**
     * Formats a value typed by the author as a script literal: numbers, True/False/None,
     * already quoted strings and list/dict displays go through verbatim, anything else is quoted.
     */
    public static String literal(String value) {
        if (value == null || value.isEmpty()) return "\"\"";
        if (isNumber(value) || PYTHON_CONSTANTS.contains(value)) return value;
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) return value;
        if (value.startsWith("[") || value.startsWith("{")) return value;
        return quoted(value);
    }

    public static String line(String indent, String statement) {
        return indent + statement + "\n";
    }

    public static String imageDefinition(String indent, String identifier, String path) {
        return line(indent, "image " + identifier + " = " + quoted(path));
    }

    public static String characterDefinition(String indent, String identifier, String displayName) {
        String character = displayName == null || displayName.isBlank()
                ? "Character(None)"
                : "Character('" + escapeSingleQuoted(displayName.trim()) + "')";
        return line(indent, "define " + identifier + " = " + character);
    }
}

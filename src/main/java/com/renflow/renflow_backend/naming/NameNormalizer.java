package com.renflow.renflow_backend.naming;

import java.util.regex.Pattern;

/**
 * Turns a human-entered name into a script identifier.
 * "Jane Doe" -> "Jane_Doe", "jane-doe" -> "jane_doe", "1st mate" -> "id_1st_mate", "!!!" -> "id".
 * Case is preserved and non-ASCII letters survive. Normalizing an identifier returns it unchanged.
 */
public final class NameNormalizer {

    static final String PREFIX = "id";

    private static final Pattern SEPARATORS   = Pattern.compile("[\\s-]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_WORD     = Pattern.compile("\\W", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern UNDERSCORES  = Pattern.compile("_{2,}");

    private NameNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) return PREFIX;
        String name = SEPARATORS.matcher(raw.trim()).replaceAll("_");
        name = NON_WORD.matcher(name).replaceAll("");
        name = UNDERSCORES.matcher(name).replaceAll("_");
        name = stripUnderscores(name);

        if (name.isEmpty()) return PREFIX;
        if (Character.isDigit(name.codePointAt(0))) return PREFIX + "_" + name;
        return name;
    }

    private static String stripUnderscores(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == '_') start++;
        while (end > start && name.charAt(end - 1) == '_') end--;
        return name.substring(start, end);
    }
}

package com.dependforce.dependency;

import com.dependforce.config.AppConfig;

import java.util.regex.Pattern;

/**
 * Normalizes creation scripts for replay: strips the ANSI_NULLS ON and
 * QUOTED_IDENTIFIER ON statements, which restate the session defaults, and
 * terminates the script with a batch separator. OFF settings change how the
 * module behaves and are kept with their batch separator.
 */
public final class ScriptNormalizer {

    // A default-valued toggle, optionally followed by its own GO line
    private static final Pattern SESSION_TOGGLE = Pattern.compile(
        "SET\\s+(ANSI_NULLS|QUOTED_IDENTIFIER)\\s+ON\\b[ \\t]*;?([ \\t]*\\r?\\n\\s*GO\\b[ \\t]*)?",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_TERMINATOR = Pattern.compile(
        "(\\r?\\n|^)\\s*" + AppConfig.BATCH_TERMINATOR + "\\s*$",
        Pattern.CASE_INSENSITIVE);

    private ScriptNormalizer() {
    }

    /**
     * @param script raw creation script, may be null
     * @return the normalized script ending with the batch terminator, or null if script was null
     */
    public static String normalize(String script) {
        if (script == null) {
            return null;
        }
        String stripped = SESSION_TOGGLE.matcher(script).replaceAll("").trim();
        stripped = TRAILING_TERMINATOR.matcher(stripped).replaceAll("").trim();
        if (stripped.isEmpty()) {
            return AppConfig.BATCH_TERMINATOR;
        }
        return stripped + AppConfig.SCRIPT_LINE_SEPARATOR + AppConfig.BATCH_TERMINATOR;
    }
}

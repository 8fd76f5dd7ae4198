package com.marketintel.extract;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONParserConfiguration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers one JSON object or array from free model text.
 * <p>
 * The text may be surrounded by prose or wrapped in a fenced code block. The first {@code {} or
 * {@code [} starts the candidate; its end is found by counting that delimiter pair only. Braces
 * inside quoted strings are counted too, so a string such as {@code "a}"} can end the candidate
 * early; the caller's default covers those cases.
 * <p>
 * The candidate is parsed in strict mode: unquoted keys or values, single quotes and trailing
 * commas are rejected.
 * <p>
 * Never throws: anything that cannot be recovered yields the supplied default.
 */
public final class StructuredOutputExtractor {
    private static final Logger LOG = LogManager.getLogger(StructuredOutputExtractor.class);
    private static final JSONParserConfiguration STRICT = new JSONParserConfiguration().withStrictMode(true);
    private static final Pattern FENCE = Pattern.compile("```+[A-Za-z0-9_+-]*[ \\t]*\\r?\\n?([\\s\\S]*?)\\s*```+");

    public Object extract(String text, Object defaultValue) {
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            String body = stripFence(text);
            int objectStart = body.indexOf('{');
            int arrayStart = body.indexOf('[');
            if (objectStart < 0 && arrayStart < 0) {
                return defaultValue;
            }

            int start;
            char open;
            char close;
            if (arrayStart < 0 || (objectStart >= 0 && objectStart < arrayStart)) {
                start = objectStart;
                open = '{';
                close = '}';
            } else {
                start = arrayStart;
                open = '[';
                close = ']';
            }

            int end = findClosing(body, start, open, close);
            if (end < 0) {
                return defaultValue;
            }
            String candidate = body.substring(start, end + 1);
            if (open == '{') {
                return new JSONObject(candidate, STRICT);
            }
            return new JSONArray(candidate, STRICT);
        } catch (RuntimeException e) {
            LOG.debug("structured output parse failed: {}", e.getMessage());
            return defaultValue;
        }
    }

    public JSONArray extractArray(String text, JSONArray defaultValue) {
        Object value = extract(text, defaultValue);
        return value instanceof JSONArray array ? array : defaultValue;
    }

    public JSONObject extractObject(String text, JSONObject defaultValue) {
        Object value = extract(text, defaultValue);
        return value instanceof JSONObject object ? object : defaultValue;
    }

    static String stripFence(String text) {
        Matcher m = FENCE.matcher(text);
        if (m.find()) {
            return m.group(1);
        }
        return text;
    }

    private static int findClosing(String body, int start, char open, char close) {
        int depth = 0;
        for (int i = start; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}

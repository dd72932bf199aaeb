package io.fetch4j.internal.mongo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps metadata keys to and from a form MongoDB accepts as field names.
 *
 * <p>Page metadata keys come from {@code <meta name|property>} and often contain dots ({@code DC.title},
 * {@code msvalidate.01}). A dot is stored as U+FF0E and a leading {@code $} as U+FF04; nested maps and lists are
 * walked so every level is covered.
 */
final class MetadataKeys {

    static final char DOT = '.';
    static final char DOT_REPLACEMENT = '\uFF0E';
    static final char DOLLAR = '$';
    static final char DOLLAR_REPLACEMENT = '\uFF04';

    private MetadataKeys() {
    }

    static Map<String, Object> escape(Map<String, Object> metadata) {
        return rewrite(metadata, true);
    }

    static Map<String, Object> unescape(Map<String, Object> metadata) {
        return rewrite(metadata, false);
    }

    static String escapeKey(String key) {
        String escaped = key.replace(DOT, DOT_REPLACEMENT);
        if (!escaped.isEmpty() && escaped.charAt(0) == DOLLAR) {
            escaped = DOLLAR_REPLACEMENT + escaped.substring(1);
        }
        return escaped;
    }

    static String unescapeKey(String key) {
        String plain = key.replace(DOT_REPLACEMENT, DOT);
        if (!plain.isEmpty() && plain.charAt(0) == DOLLAR_REPLACEMENT) {
            plain = DOLLAR + plain.substring(1);
        }
        return plain;
    }

    private static Map<String, Object> rewrite(Map<String, Object> metadata, boolean escape) {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>(metadata.size());
        for (Map.Entry<String, Object> e : metadata.entrySet()) {
            String key = escape ? escapeKey(e.getKey()) : unescapeKey(e.getKey());
            out.put(key, rewriteValue(e.getValue(), escape));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object rewriteValue(Object value, boolean escape) {
        if (value instanceof Map<?, ?> nested) {
            return rewrite((Map<String, Object>) nested, escape);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(rewriteValue(item, escape));
            }
            return out;
        }
        return value;
    }
}

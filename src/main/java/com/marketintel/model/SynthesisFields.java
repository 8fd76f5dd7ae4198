package com.marketintel.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class SynthesisFields {
    private SynthesisFields() {
    }

    static boolean hasText(JSONObject o, String key) {
        if (o == null || !o.has(key) || o.isNull(key)) {
            return false;
        }
        Object value = o.opt(key);
        return value instanceof String s && !s.isBlank();
    }

    static String requireText(JSONObject o, String key) {
        if (!hasText(o, key)) {
            throw new IllegalArgumentException("missing required key: " + key);
        }
        return o.getString(key).trim();
    }

    static Map<String, Object> extras(JSONObject o, Set<String> required) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : o.keySet()) {
            if (required.contains(key) || o.isNull(key)) {
                continue;
            }
            Object value = o.get(key);
            if (value instanceof JSONArray array) {
                out.put(key, array.toList());
            } else if (value instanceof JSONObject object) {
                out.put(key, object.toMap());
            } else {
                out.put(key, value);
            }
        }
        return out;
    }

    static JSONObject write(Map<String, Object> extras, String nameKey, String name, String description) {
        JSONObject o = new JSONObject();
        o.put(nameKey, name);
        o.put("description", description);
        if (extras != null) {
            for (Map.Entry<String, Object> e : extras.entrySet()) {
                o.put(e.getKey(), JSONObject.wrap(e.getValue()));
            }
        }
        return o;
    }
}

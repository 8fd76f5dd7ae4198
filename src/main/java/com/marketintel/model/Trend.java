package com.marketintel.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A market trend. Common extras: supporting_evidence, estimated_impact, timeframe.
 */
@EqualsAndHashCode
@ToString
public final class Trend implements SynthesisItem {
    public static final String NAME_KEY = "trend_name";
    public static final Set<String> REQUIRED_KEYS = Set.of(NAME_KEY, "description");

    private final String trendName;
    private final String description;
    private final Map<String, Object> extras;

    public Trend(String trendName, String description, Map<String, Object> extras) {
        this.trendName = trendName;
        this.description = description;
        this.extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static boolean isValid(JSONObject o) {
        return SynthesisFields.hasText(o, NAME_KEY) && SynthesisFields.hasText(o, "description");
    }

    public static Trend fromJson(JSONObject o) {
        return new Trend(
                SynthesisFields.requireText(o, NAME_KEY),
                SynthesisFields.requireText(o, "description"),
                SynthesisFields.extras(o, REQUIRED_KEYS)
        );
    }

    public static Trend placeholder() {
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("supporting_evidence", "N/A");
        extras.put("estimated_impact", "Unknown");
        extras.put("timeframe", "Unknown");
        return new Trend("Default Trend", "No specific trends identified.", extras);
    }

    public String trendName() {
        return trendName;
    }

    @Override
    public String name() {
        return trendName;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Map<String, Object> extras() {
        return extras;
    }

    public String extra(String key) {
        Object value = extras.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public JSONObject toJson() {
        return SynthesisFields.write(extras, NAME_KEY, trendName, description);
    }
}

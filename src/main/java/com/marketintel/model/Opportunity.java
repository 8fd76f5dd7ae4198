package com.marketintel.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.json.JSONObject;

import java.util.Map;
import java.util.Set;

/**
 * A market opportunity. Common extras: target_segment, competitive_advantage,
 * estimated_potential, timeframe_to_capture.
 */
@EqualsAndHashCode
@ToString
public final class Opportunity implements SynthesisItem {
    public static final String NAME_KEY = "opportunity_name";
    public static final Set<String> REQUIRED_KEYS = Set.of(NAME_KEY, "description");

    private final String opportunityName;
    private final String description;
    private final Map<String, Object> extras;

    public Opportunity(String opportunityName, String description, Map<String, Object> extras) {
        this.opportunityName = opportunityName;
        this.description = description;
        this.extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static boolean isValid(JSONObject o) {
        return SynthesisFields.hasText(o, NAME_KEY) && SynthesisFields.hasText(o, "description");
    }

    public static Opportunity fromJson(JSONObject o) {
        return new Opportunity(
                SynthesisFields.requireText(o, NAME_KEY),
                SynthesisFields.requireText(o, "description"),
                SynthesisFields.extras(o, REQUIRED_KEYS)
        );
    }

    public static Opportunity placeholder() {
        return new Opportunity("Default Opportunity", "N/A", Map.of());
    }

    public String opportunityName() {
        return opportunityName;
    }

    @Override
    public String name() {
        return opportunityName;
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
        return SynthesisFields.write(extras, NAME_KEY, opportunityName, description);
    }
}

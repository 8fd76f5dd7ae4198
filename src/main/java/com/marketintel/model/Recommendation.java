package com.marketintel.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.json.JSONObject;

import java.util.Map;
import java.util.Set;

/**
 * A strategic recommendation. Common extras: implementation_steps, expected_outcome,
 * resource_requirements, priority_level, success_metrics.
 */
@EqualsAndHashCode
@ToString
public final class Recommendation implements SynthesisItem {
    public static final String NAME_KEY = "strategy_title";
    public static final Set<String> REQUIRED_KEYS = Set.of(NAME_KEY, "description");

    private final String strategyTitle;
    private final String description;
    private final Map<String, Object> extras;

    public Recommendation(String strategyTitle, String description, Map<String, Object> extras) {
        this.strategyTitle = strategyTitle;
        this.description = description;
        this.extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static boolean isValid(JSONObject o) {
        return SynthesisFields.hasText(o, NAME_KEY) && SynthesisFields.hasText(o, "description");
    }

    public static Recommendation fromJson(JSONObject o) {
        return new Recommendation(
                SynthesisFields.requireText(o, NAME_KEY),
                SynthesisFields.requireText(o, "description"),
                SynthesisFields.extras(o, REQUIRED_KEYS)
        );
    }

    public static Recommendation placeholder() {
        return new Recommendation("Default Strategy", "N/A", Map.of());
    }

    public String strategyTitle() {
        return strategyTitle;
    }

    @Override
    public String name() {
        return strategyTitle;
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
        return SynthesisFields.write(extras, NAME_KEY, strategyTitle, description);
    }
}

package com.marketintel.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provider-tagged financial record, such as a quote or a company overview.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FinancialItem {
    public final String provider;
    public final String type;
    public final String symbol;
    public final Map<String, Object> payload;

    public static FinancialItem of(String provider, String type, String symbol, JSONObject payload) {
        return new FinancialItem(
                provider,
                type,
                symbol,
                payload == null ? Map.of() : withoutNulls(payload.toMap())
        );
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            if (e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    public JSONObject toJson() {
        JSONObject o = new JSONObject();
        o.put("provider", provider == null ? "" : provider);
        o.put("type", type == null ? "" : type);
        o.put("symbol", symbol == null ? "" : symbol);
        o.put("data", payload == null ? new JSONObject() : new JSONObject(payload));
        return o;
    }

    public static FinancialItem fromJson(JSONObject o) {
        return of(o.optString("provider", ""), o.optString("type", ""), o.optString("symbol", ""), o.optJSONObject("data"));
    }
}

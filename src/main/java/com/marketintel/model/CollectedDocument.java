package com.marketintel.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONObject;

/**
 * One collected web/news document. {@code url} is the deduplication key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CollectedDocument {
    public final String source;
    public final String title;
    public final String summary;
    public final String fullText;
    public final String url;

    public boolean hasText() {
        return fullText != null && !fullText.isBlank();
    }

    public JSONObject toJson() {
        JSONObject o = new JSONObject();
        o.put("source", nz(source));
        o.put("title", nz(title));
        o.put("summary", nz(summary));
        o.put("full_content", nz(fullText));
        o.put("url", nz(url));
        return o;
    }

    public static CollectedDocument fromJson(JSONObject o) {
        return new CollectedDocument(
                o.optString("source", ""),
                o.optString("title", ""),
                o.optString("summary", ""),
                o.optString("full_content", ""),
                o.optString("url", "")
        );
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }
}

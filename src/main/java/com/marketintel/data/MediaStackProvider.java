package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.model.CollectedDocument;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MediaStackProvider implements DataSource {
    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String endpoint;

    public MediaStackProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.endpoint = config.getString("provider.mediastack.url");
    }

    @Override
    public String name() {
        return "mediastack";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.DIRECT;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.MEDIASTACK);
    }

    @Override
    public List<CollectedDocument> fetchDirect(String query) throws Exception {
        if (!isConfigured()) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_key", apiKeys.get(ApiKeys.MEDIASTACK));
        params.put("keywords", query);
        params.put("limit", "10");
        params.put("languages", "en");
        JSONObject root = new JSONObject(http.getText(HttpClientEx.withQuery(endpoint, params)));
        JSONArray data = root.optJSONArray("data");
        List<CollectedDocument> out = new ArrayList<>();
        if (data == null) {
            return out;
        }
        for (int i = 0; i < data.length(); i++) {
            JSONObject a = data.optJSONObject(i);
            if (a == null || a.optString("url", "").isBlank()) {
                continue;
            }
            String description = a.optString("description", "");
            out.add(CollectedDocument.builder()
                    .source("MediaStack - " + a.optString("source", "Unknown"))
                    .title(a.optString("title", ""))
                    .summary(description)
                    .fullText(description)
                    .url(a.getString("url").trim())
                    .build());
        }
        return out;
    }
}

package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SerpApiSearchProvider implements DataSource {
    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String endpoint;

    public SerpApiSearchProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.endpoint = config.getString("provider.serpapi.url");
    }

    @Override
    public String name() {
        return "serpapi";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.SEARCH;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.SERPAPI);
    }

    @Override
    public List<String> search(String query) throws Exception {
        if (!isConfigured()) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("engine", "google");
        params.put("num", "10");
        params.put("api_key", apiKeys.get(ApiKeys.SERPAPI));
        JSONObject root = new JSONObject(http.getText(HttpClientEx.withQuery(endpoint, params)));
        JSONArray organic = root.optJSONArray("organic_results");
        List<String> urls = new ArrayList<>();
        if (organic == null) {
            return urls;
        }
        for (int i = 0; i < organic.length(); i++) {
            JSONObject r = organic.optJSONObject(i);
            String link = r == null ? "" : r.optString("link", "").trim();
            if (!link.isEmpty()) {
                urls.add(link);
            }
        }
        return urls;
    }
}

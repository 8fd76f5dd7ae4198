package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary web search. A run cannot start without its credential.
 */
public final class TavilySearchProvider implements DataSource {
    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String endpoint;
    private final int maxResults;

    public TavilySearchProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.endpoint = config.getString("provider.tavily.url");
        this.maxResults = Math.max(1, config.getInt("provider.tavily.max_results", 7));
    }

    @Override
    public String name() {
        return "tavily";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.SEARCH;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.TAVILY);
    }

    @Override
    public boolean isPrimary() {
        return true;
    }

    @Override
    public String credentialEnv() {
        return ApiKeys.TAVILY;
    }

    @Override
    public List<String> search(String query) throws Exception {
        if (!isConfigured()) {
            return List.of();
        }
        JSONObject body = new JSONObject()
                .put("api_key", apiKeys.get(ApiKeys.TAVILY))
                .put("query", query)
                .put("search_depth", "advanced")
                .put("include_answer", false)
                .put("max_results", maxResults);
        JSONObject root = new JSONObject(http.postJson(endpoint, body.toString()));
        JSONArray results = root.optJSONArray("results");
        List<String> urls = new ArrayList<>();
        if (results == null) {
            return urls;
        }
        for (int i = 0; i < results.length(); i++) {
            JSONObject r = results.optJSONObject(i);
            String url = r == null ? "" : r.optString("url", "").trim();
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }
        return urls;
    }
}

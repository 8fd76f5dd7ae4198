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

/**
 * NewsAPI "everything" endpoint; articles arrive complete, so their URLs skip the content fetch.
 */
public final class NewsApiProvider implements DataSource {
    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String endpoint;

    public NewsApiProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.endpoint = config.getString("provider.newsapi.url");
    }

    @Override
    public String name() {
        return "newsapi";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.DIRECT;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.NEWS_API);
    }

    @Override
    public List<CollectedDocument> fetchDirect(String query) throws Exception {
        if (!isConfigured()) {
            return List.of();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("language", "en");
        params.put("sortBy", "relevancy");
        params.put("pageSize", "10");
        params.put("apiKey", apiKeys.get(ApiKeys.NEWS_API));
        JSONObject root = new JSONObject(http.getText(HttpClientEx.withQuery(endpoint, params)));
        JSONArray articles = root.optJSONArray("articles");
        List<CollectedDocument> out = new ArrayList<>();
        if (articles == null) {
            return out;
        }
        for (int i = 0; i < articles.length(); i++) {
            JSONObject a = articles.optJSONObject(i);
            if (a == null || a.optString("url", "").isBlank()) {
                continue;
            }
            JSONObject source = a.optJSONObject("source");
            String description = a.optString("description", "");
            out.add(CollectedDocument.builder()
                    .source("NewsAPI - " + (source == null ? "Unknown" : source.optString("name", "Unknown")))
                    .title(a.optString("title", ""))
                    .summary(description)
                    .fullText(a.optString("content", description))
                    .url(a.getString("url").trim())
                    .build());
        }
        return out;
    }
}

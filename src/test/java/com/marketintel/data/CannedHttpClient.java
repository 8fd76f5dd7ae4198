package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;

import java.util.ArrayList;
import java.util.List;

/**
 * Returns a fixed body for every request and records the requested URLs and posted bodies.
 */
final class CannedHttpClient extends HttpClientEx {
    final List<String> requests = new ArrayList<>();
    final List<String> posted = new ArrayList<>();
    private final String body;

    CannedHttpClient(Config config, String body) {
        super(config);
        this.body = body;
    }

    @Override
    public String getText(String url) {
        requests.add(url);
        return body;
    }

    @Override
    public String postJson(String url, String json) {
        requests.add(url);
        posted.add(json);
        return body;
    }
}

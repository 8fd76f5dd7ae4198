package com.marketintel.data.http;

import com.marketintel.config.Config;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin blocking HTTP client shared by the data providers. Every request carries a timeout;
 * non-2xx responses raise {@link IOException}.
 */
public class HttpClientEx {
    private final HttpClient client;
    private final int timeoutSeconds;
    private final String userAgent;

    public HttpClientEx(Config config) {
        this.timeoutSeconds = Math.max(1, config.getInt("http.timeout_sec", 20));
        this.userAgent = config.getString("http.user_agent", "MarketIntel/1.0");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new IOException("HTTP " + resp.statusCode() + " for " + redact(url));
    }

    public String postJson(String url, String json) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new IOException("HTTP " + resp.statusCode() + " for " + redact(url));
    }

    public static String withQuery(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> e : params.entrySet()) {
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8));
        }
        return baseUrl + (baseUrl.contains("?") ? "&" : "?") + joiner;
    }

    /**
     * Masks credential query parameters so URLs can be logged.
     */
    public static String redact(String url) {
        if (url == null) {
            return "";
        }
        return url.replaceAll("(?i)((?:api_?key|access_key|apikey)=)[^&]+", "$1***");
    }
}

package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.model.FinancialItem;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Financial Modeling Prep company profile and latest quote.
 */
public final class FmpFinancialProvider implements DataSource {
    static final String PROVIDER = "FinancialModelingPrep";

    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String baseUrl;

    public FmpFinancialProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.baseUrl = trimSlash(config.getString("provider.fmp.url"));
    }

    @Override
    public String name() {
        return "fmp";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.FINANCIAL;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.FMP);
    }

    @Override
    public List<FinancialItem> fetchFinancial(String symbolHint) throws Exception {
        if (!isConfigured() || symbolHint == null || symbolHint.isBlank()) {
            return List.of();
        }
        String symbol = symbolHint.trim();
        List<FinancialItem> out = new ArrayList<>();
        JSONObject profile = firstObject(http.getText(endpoint("profile", symbol)));
        if (profile != null) {
            out.add(FinancialItem.of(PROVIDER, "company_profile", symbol, profile));
        }
        JSONObject quote = firstObject(http.getText(endpoint("quote", symbol)));
        if (quote != null) {
            out.add(FinancialItem.of(PROVIDER, "stock_quote", symbol, quote));
        }
        return out;
    }

    private String endpoint(String resource, String symbol) {
        String path = baseUrl + "/" + resource + "/" + URLEncoder.encode(symbol, StandardCharsets.UTF_8);
        return HttpClientEx.withQuery(path, Map.of("apikey", apiKeys.get(ApiKeys.FMP)));
    }

    private static JSONObject firstObject(String body) {
        Object value = new JSONTokener(body).nextValue();
        if (value instanceof JSONArray array) {
            return array.isEmpty() ? null : array.optJSONObject(0);
        }
        if (value instanceof JSONObject object) {
            return object.isEmpty() ? null : object;
        }
        return null;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.model.FinancialItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Alpha Vantage latest daily bar plus company overview. The overview is optional: its failure
 * keeps the daily bar.
 */
public final class AlphaVantageFinancialProvider implements DataSource {
    private static final Logger LOG = LogManager.getLogger(AlphaVantageFinancialProvider.class);
    static final String PROVIDER = "AlphaVantage";

    private final ApiKeys apiKeys;
    private final HttpClientEx http;
    private final String endpoint;

    public AlphaVantageFinancialProvider(Config config, ApiKeys apiKeys, HttpClientEx http) {
        this.apiKeys = apiKeys;
        this.http = http;
        this.endpoint = config.getString("provider.alphavantage.url");
    }

    @Override
    public String name() {
        return "alphavantage";
    }

    @Override
    public DataSourceRole role() {
        return DataSourceRole.FINANCIAL;
    }

    @Override
    public boolean isConfigured() {
        return apiKeys.has(ApiKeys.ALPHA_VANTAGE);
    }

    @Override
    public List<FinancialItem> fetchFinancial(String symbolHint) throws Exception {
        if (!isConfigured() || symbolHint == null || symbolHint.isBlank()) {
            return List.of();
        }
        String symbol = symbolHint.trim();
        List<FinancialItem> out = new ArrayList<>();

        JSONObject daily = new JSONObject(http.getText(url("TIME_SERIES_DAILY", symbol)));
        JSONObject series = daily.optJSONObject("Time Series (Daily)");
        if (series != null && !series.isEmpty()) {
            String latestDate = new TreeSet<>(series.keySet()).last();
            JSONObject bar = new JSONObject(series.getJSONObject(latestDate).toMap());
            bar.put("date", latestDate);
            out.add(FinancialItem.of(PROVIDER, "daily_time_series_latest", symbol, bar));
        }

        try {
            JSONObject overview = new JSONObject(http.getText(url("OVERVIEW", symbol)));
            if (!overview.isEmpty()) {
                out.add(FinancialItem.of(PROVIDER, "company_overview", symbol, overview));
            }
        } catch (Exception e) {
            LOG.warn("alphavantage overview unavailable symbol={} err={}", symbol, e.getMessage());
        }
        return out;
    }

    private String url(String function, String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", function);
        params.put("symbol", symbol);
        if ("TIME_SERIES_DAILY".equals(function)) {
            params.put("outputsize", "compact");
        }
        params.put("apikey", apiKeys.get(ApiKeys.ALPHA_VANTAGE));
        return HttpClientEx.withQuery(endpoint, params);
    }
}

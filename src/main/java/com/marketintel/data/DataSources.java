package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;

import java.util.List;

public final class DataSources {
    private DataSources() {
    }

    /**
     * All built-in providers, primary search first. Unconfigured ones are kept and skipped at call time.
     */
    public static List<DataSource> defaults(Config config, ApiKeys apiKeys, HttpClientEx http) {
        return List.of(
                new TavilySearchProvider(config, apiKeys, http),
                new SerpApiSearchProvider(config, apiKeys, http),
                new NewsApiProvider(config, apiKeys, http),
                new MediaStackProvider(config, apiKeys, http),
                new FmpFinancialProvider(config, apiKeys, http),
                new AlphaVantageFinancialProvider(config, apiKeys, http)
        );
    }
}

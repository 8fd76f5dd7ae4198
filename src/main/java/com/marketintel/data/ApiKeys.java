package com.marketintel.data;

import com.marketintel.config.Config;

import java.util.function.Function;

/**
 * Credential lookup: environment variable first, then {@code api_keys.<ENV_NAME>} in config.
 */
public final class ApiKeys {
    public static final String TAVILY = "TAVILY_API_KEY";
    public static final String SERPAPI = "SERPAPI_API_KEY";
    public static final String NEWS_API = "NEWS_API_KEY";
    public static final String MEDIASTACK = "MEDIASTACK_API_KEY";
    public static final String FMP = "FINANCIAL_MODELING_PREP_API_KEY";
    public static final String ALPHA_VANTAGE = "ALPHA_VANTAGE_API_KEY";

    private final Config config;
    private final Function<String, String> env;

    public ApiKeys(Config config) {
        this(config, System::getenv);
    }

    public ApiKeys(Config config, Function<String, String> env) {
        this.config = config;
        this.env = env;
    }

    public String get(String envName) {
        String fromEnv = env.apply(envName);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return fromEnv.trim();
        }
        return config.getString("api_keys." + envName);
    }

    public boolean has(String envName) {
        return !get(envName).isEmpty();
    }
}

package com.marketintel.data;

public enum DataSourceRole {
    /** Returns candidate URLs for a query. */
    SEARCH,
    /** Returns complete documents for a query. */
    DIRECT,
    /** Returns structured records for a ticker symbol. */
    FINANCIAL
}

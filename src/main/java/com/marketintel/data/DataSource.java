package com.marketintel.data;

import com.marketintel.model.CollectedDocument;
import com.marketintel.model.FinancialItem;

import java.util.List;

/**
 * An external data provider. A provider without a configured credential reports
 * {@code isConfigured() == false} and is skipped; it never throws for that reason.
 * Each provider implements the operation that matches its {@link #role()}.
 */
public interface DataSource {
    String name();

    DataSourceRole role();

    boolean isConfigured();

    /**
     * The primary search provider is the only one whose missing credential aborts a run.
     */
    default boolean isPrimary() {
        return false;
    }

    /**
     * Environment variable that holds this provider's credential, for error messages.
     */
    default String credentialEnv() {
        return "";
    }

    default List<String> search(String query) throws Exception {
        return List.of();
    }

    default List<CollectedDocument> fetchDirect(String query) throws Exception {
        return List.of();
    }

    default List<FinancialItem> fetchFinancial(String symbolHint) throws Exception {
        return List.of();
    }
}

package com.marketintel.data;

import com.marketintel.model.CollectedDocument;

public interface ContentFetcher {
    /**
     * Loads and cleans the page at {@code url}.
     *
     * @throws Exception when the page cannot be loaded; callers record a placeholder document
     */
    CollectedDocument fetchContent(String url) throws Exception;
}

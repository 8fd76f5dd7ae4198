package com.marketintel.pipeline;

/**
 * System instructions for the model calls made by the pipeline and chat.
 */
public final class Prompts {
    private Prompts() {
    }

    public static final String TREND_ANALYSIS = String.join("\n",
            "You are a market research analyst.",
            "Identify the most important market trends in the supplied documents and financial data.",
            "Return ONLY a JSON array. Each element must be an object with the keys:",
            "trend_name, description, supporting_evidence, estimated_impact, timeframe.",
            "Do not add any text before or after the JSON."
    );

    public static final String OPPORTUNITY_IDENTIFICATION = String.join("\n",
            "You are a business opportunity analyst.",
            "Using the supplied market trends and documents, identify concrete business opportunities.",
            "Return ONLY a JSON array. Each element must be an object with the keys:",
            "opportunity_name, description, target_segment, competitive_advantage, estimated_potential, timeframe_to_capture.",
            "Do not add any text before or after the JSON."
    );

    public static final String STRATEGY_RECOMMENDATION = String.join("\n",
            "You are a strategy consultant.",
            "Using the supplied trends and opportunities, recommend strategic actions.",
            "Return ONLY a JSON array. Each element must be an object with the keys:",
            "strategy_title, description, implementation_steps, expected_outcome, resource_requirements,",
            "priority_level, success_metrics.",
            "Do not add any text before or after the JSON."
    );

    public static final String REPORT_TEMPLATE = String.join("\n",
            "You design market intelligence reports.",
            "Write a Markdown report template for the supplied market domain and findings summary.",
            "Use section headings for an executive summary, key trends, opportunities,",
            "strategic recommendations and data sources. Use bracketed placeholders for content.",
            "Return only the Markdown template."
    );

    public static final String REPORT_GENERATION = String.join("\n",
            "You are a market intelligence writer.",
            "Fill in the supplied Markdown template using ONLY the supplied analysis results.",
            "Keep every section heading of the template. Return only the finished Markdown report."
    );

    public static final String RETRIEVAL_ANSWER = String.join("\n",
            "Answer the question using ONLY the context passages below.",
            "If the context does not contain the answer, reply exactly:",
            RetrievalAnswerStage.NO_ANSWER
    );

    public static final String CHAT = String.join("\n",
            "You are a helpful market intelligence assistant.",
            "Answer concisely and say so when you are unsure."
    );
}

package com.marketintel.model;

import com.marketintel.retrieval.IndexHandle;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunStateTest {

    @Test
    void create_shouldNormalizeInputsAndDefaultEveryCollectionToEmpty() {
        RunState state = RunState.create("  Electric   Vehicles ", " battery supply ", null);

        assertEquals("Electric Vehicles", state.domain());
        assertEquals("battery supply", state.query());
        assertEquals("", state.question());
        assertFalse(state.hasQuestion());
        assertTrue(state.collectedDocuments().isEmpty());
        assertTrue(state.financialItems().isEmpty());
        assertTrue(state.trends().isEmpty());
        assertTrue(state.opportunities().isEmpty());
        assertTrue(state.recommendations().isEmpty());
        assertTrue(state.chartRefs().isEmpty());
        assertTrue(state.indexHandle().isEmpty());
        assertTrue(state.answer().isEmpty());
    }

    @Test
    void create_shouldAssignDistinctRunIds() {
        assertNotEquals(RunState.create("AI", "", "").runId(), RunState.create("AI", "", "").runId());
    }

    @Test
    void create_shouldRejectInvalidDomain() {
        assertThrows(IllegalArgumentException.class, () -> RunState.create("", "query", ""));
        assertThrows(IllegalArgumentException.class, () -> RunState.create("   ", "query", ""));
        assertThrows(IllegalArgumentException.class, () -> RunState.create("AI; DROP TABLE", "query", ""));
        assertThrows(IllegalArgumentException.class, () -> RunState.create("Fintech/Payments", "query", ""));
    }

    @Test
    void create_shouldRejectShortQueryOrQuestion() {
        assertThrows(IllegalArgumentException.class, () -> RunState.create("Technology", "ai", ""));
        assertThrows(IllegalArgumentException.class, () -> RunState.create("Technology", "", " ok "));
    }

    @Test
    void create_shouldAcceptHyphensAndDigits() {
        RunState state = RunState.create("Web3 - DeFi", "", "");

        assertEquals("Web3 - DeFi", state.domain());
    }

    @Test
    void setters_shouldCopyAndNeverExposeNull() {
        RunState state = RunState.create("Technology", "", "");
        List<Trend> trends = new ArrayList<>(List.of(Trend.placeholder()));

        state.setTrends(trends);
        trends.clear();
        state.setOpportunities(null);

        assertEquals(1, state.trends().size());
        assertTrue(state.opportunities().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> state.trends().add(Trend.placeholder()));
    }

    @Test
    void json_shouldPreserveEveryField() {
        RunState state = RunState.create("Technology", "AI regulation", "What changed?");
        state.setCollectedDocuments(List.of(new CollectedDocument("web", "Title", "Sum", "Full", "https://a.example/1")));
        state.setFinancialItems(List.of(FinancialItem.of("fmp", "stock_quote", "MSFT", new JSONObject().put("price", 410))));
        state.setTrends(List.of(Trend.placeholder()));
        state.setOpportunities(List.of(new Opportunity("Compliance tooling", "Audit software", Map.of("target_segment", "banks"))));
        state.setRecommendations(List.of(Recommendation.placeholder()));
        state.setReportTemplate("# Template");
        state.setIndexHandle(new IndexHandle("idx-1", 12));
        state.setAnswer("Because of new rules.");
        state.setOutputDir(Path.of("outputs", "runs", "technology_abc"));
        state.setChartRefs(List.of("chart.png"));
        state.setDataFiles(List.of("technology_data_sources.json"));
        state.setReportFile("technology_report_abcd.md");
        state.setRagLogFile("rag_responses_abcd.log");

        RunState restored = RunState.fromJson(new JSONObject(state.toJson().toString()));

        assertEquals(state, restored);
        assertEquals("banks", restored.opportunities().get(0).extra("target_segment"));
        assertEquals(12, restored.indexHandle().orElseThrow().passageCount());
    }
}

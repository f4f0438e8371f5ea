package co.fanki.codemap.flow.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for FlowChart and its JSON form.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowChartTest {

    private final List<FlowStep> steps = List.of(
            new FlowStep(1, FlowKind.START, "app.py", "Module entry", 1, null,
                    "#58a6ff"),
            new FlowStep(2, FlowKind.CALL, "main(...)", "function call", 9, 1,
                    "#3fb950"));

    @Test
    void whenAssembling_givenSteps_shouldDeriveOneEdgePerChild() {
        final FlowChart chart = FlowChart.of("src/app.py", steps, "graph");

        assertEquals(List.of(new FlowEdge(1, 2)), chart.edges());
        assertEquals(2, chart.totalSteps());
    }

    @Test
    void whenSerializing_givenChart_shouldWriteOrderedFields()
            throws Exception {
        final FlowChart chart = FlowChart.of("src/app.py", steps, "graph");

        final String json = chart.toJson();
        final JsonNode node = new ObjectMapper().readTree(json);

        final List<String> fields = new ArrayList<>();
        node.fieldNames().forEachRemaining(fields::add);
        assertEquals(List.of("file", "total_steps", "steps", "edges",
                "mermaid"), fields);
        assertEquals(2, node.get("total_steps").asInt());

        final JsonNode root = node.get("steps").get(0);
        assertTrue(root.has("parent"));
        assertTrue(root.get("parent").isNull());
        assertEquals("n1", root.get("sid").asText());
        assertEquals("start", root.get("kind").asText());
        assertEquals(1, node.get("steps").get(1).get("parent").asInt());
        assertEquals(2, node.get("edges").get(0).get("to").asInt());
    }

    @Test
    void whenCreatingStep_givenParentAfterChild_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new FlowStep(2, FlowKind.CALL, "f(...)", "", 1, 3, ""));
    }

}

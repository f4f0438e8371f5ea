package co.fanki.codemap.flow.domain;

import co.fanki.codemap.shared.DomainException;
import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * The flow diagram of one source file: its steps, the links between them
 * and the Mermaid source drawing them.
 *
 * @param file the file path as requested
 * @param steps the steps in id order
 * @param edges the parent to child links
 * @param mermaid the Mermaid flowchart source
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"file", "total_steps", "steps", "edges", "mermaid"})
public record FlowChart(
        @JsonProperty("file") String file,
        @JsonProperty("steps") List<FlowStep> steps,
        @JsonProperty("edges") List<FlowEdge> edges,
        @JsonProperty("mermaid") String mermaid
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public FlowChart {
        Preconditions.requireNonBlank(file, "File is required");
        steps = List.copyOf(steps);
        edges = List.copyOf(edges);
        Preconditions.requireNonNull(mermaid, "Mermaid source is required");
    }

    /**
     * Assembles a chart, deriving one edge per non-root step.
     *
     * @param file the file path as requested
     * @param steps the steps in id order
     * @param mermaid the Mermaid source
     * @return the chart
     */
    public static FlowChart of(final String file, final List<FlowStep> steps,
            final String mermaid) {
        final List<FlowEdge> edges = new ArrayList<>();
        for (final FlowStep step : steps) {
            if (!step.isRoot()) {
                edges.add(new FlowEdge(step.parent(), step.id()));
            }
        }
        return new FlowChart(file, steps, edges, mermaid);
    }

    @JsonProperty("total_steps")
    public int totalSteps() {
        return steps.size();
    }

    /**
     * Serializes the chart to JSON.
     *
     * @return the JSON document
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new DomainException("Failed to serialize flow chart for "
                    + file, "SERIALIZATION_ERROR", e);
        }
    }

}

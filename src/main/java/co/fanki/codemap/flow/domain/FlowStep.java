package co.fanki.codemap.flow.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One node of a flow diagram.
 *
 * @param id the 1-based step id, in pre-order
 * @param kind the step kind
 * @param label the display label, unescaped
 * @param detail an optional detail, empty if none
 * @param line the source line, 0 if not applicable
 * @param parent the parent step id, null for the root
 * @param color the display color
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"id", "sid", "kind", "label", "detail", "line",
        "parent", "color"})
public record FlowStep(
        @JsonProperty("id") int id,
        @JsonProperty("kind") FlowKind kind,
        @JsonProperty("label") String label,
        @JsonProperty("detail") String detail,
        @JsonProperty("line") int line,
        @JsonProperty("parent")
        @JsonInclude(JsonInclude.Include.ALWAYS) Integer parent,
        @JsonProperty("color") String color
) {

    /** Validates ids and defaults the detail. */
    public FlowStep {
        Preconditions.requirePositive(id, "Step id must be positive");
        Preconditions.requireNonNull(kind, "Kind is required");
        Preconditions.requireNonNull(label, "Label is required");
        Preconditions.requireNonNegative(line, "Line must not be negative");
        Preconditions.require(parent == null || parent < id,
                "A parent step must precede its children");
        detail = detail == null ? "" : detail;
    }

    /**
     * Returns the Mermaid node id of this step.
     *
     * @return the node id, e.g. {@code n3}
     */
    @JsonProperty("sid")
    public String sid() {
        return "n" + id;
    }

    @JsonIgnore
    public boolean isRoot() {
        return parent == null;
    }

}

package co.fanki.codemap.flow.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A parent to child link between two flow steps.
 *
 * @param from the parent step id
 * @param to the child step id
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowEdge(
        @JsonProperty("from") int from,
        @JsonProperty("to") int to
) {
}

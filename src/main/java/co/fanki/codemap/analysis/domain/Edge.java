package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed call edge between two modules.
 *
 * @param source the calling module path
 * @param target the module that declares the called function
 * @param label the call expression as written, e.g. {@code helper}
 *     or {@code helper.run}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("label") String label
) {

    /** Rejects blank endpoints and self edges. */
    public Edge {
        Preconditions.requireNonBlank(source, "Edge source is required");
        Preconditions.requireNonBlank(target, "Edge target is required");
        Preconditions.requireNonBlank(label, "Edge label is required");
        Preconditions.require(!source.equals(target),
                "A module cannot have an edge to itself: " + source);
    }

}

package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.DomainException;
import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The cross-file dependency graph of a scanned project.
 *
 * <p>Language-agnostic: holds the scanned modules in file-system traversal
 * order and the call edges inferred between them. A graph is built fresh
 * for every scan and never changes afterwards.</p>
 *
 * <p>Besides the raw modules and edges it answers the neighborhood
 * questions a host needs to describe a module (who calls it, what it
 * calls) and round-trips through JSON so a host can cache it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProjectGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** The absolute project root, forward slashes. */
    private final String root;

    /** The modules in traversal order. */
    private final List<ModuleRecord> modules;

    /** The inferred call edges in resolution order. */
    private final List<Edge> edges;

    /**
     * Creates a graph.
     *
     * @param theRoot the absolute project root
     * @param theModules the scanned modules in traversal order
     * @param theEdges the call edges
     */
    public ProjectGraph(final String theRoot,
            final List<ModuleRecord> theModules,
            final List<Edge> theEdges) {
        this.root = Preconditions.requireNonBlank(theRoot,
                "Project root is required").replace('\\', '/');
        this.modules = List.copyOf(Preconditions.requireNonNull(theModules,
                "Modules are required"));
        this.edges = List.copyOf(Preconditions.requireNonNull(theEdges,
                "Edges are required"));
    }

    public String root() {
        return root;
    }

    public List<ModuleRecord> modules() {
        return modules;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the aggregate counts of this graph.
     *
     * @return the module, function and class totals
     */
    public ProjectStats stats() {
        return ProjectStats.of(modules);
    }

    /**
     * Finds a module by its relative path.
     *
     * @param path the relative path, either separator style
     * @return the module, empty if the path was not scanned
     */
    public Optional<ModuleRecord> module(final String path) {
        if (path == null) {
            return Optional.empty();
        }
        final String normalized = path.replace('\\', '/');
        return modules.stream()
                .filter(m -> m.path().equals(normalized))
                .findFirst();
    }

    /**
     * Returns the modules that call into the given module.
     *
     * @param path the relative path of the called module
     * @return the distinct calling module paths, in edge order
     */
    public Set<String> callersOf(final String path) {
        final Set<String> result = new LinkedHashSet<>();
        if (path == null) {
            return result;
        }
        final String normalized = path.replace('\\', '/');
        for (final Edge edge : edges) {
            if (edge.target().equals(normalized)) {
                result.add(edge.source());
            }
        }
        return result;
    }

    /**
     * Returns the modules the given module calls into.
     *
     * @param path the relative path of the calling module
     * @return the distinct called module paths, in edge order
     */
    public Set<String> calleesOf(final String path) {
        final Set<String> result = new LinkedHashSet<>();
        if (path == null) {
            return result;
        }
        final String normalized = path.replace('\\', '/');
        for (final Edge edge : edges) {
            if (edge.source().equals(normalized)) {
                result.add(edge.target());
            }
        }
        return result;
    }

    /**
     * Serializes the graph to JSON.
     *
     * <p>Output shape: {@code root}, {@code modules}, {@code edges} and
     * {@code stats}.</p>
     *
     * @return the JSON document
     */
    public String toJson() {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("root", root);
        node.set("modules", MAPPER.valueToTree(modules));
        node.set("edges", MAPPER.valueToTree(edges));
        node.set("stats", MAPPER.valueToTree(stats()));

        try {
            return MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to serialize project graph",
                    "SERIALIZATION_ERROR", e);
        }
    }

    /**
     * Rebuilds a graph from the JSON produced by {@link #toJson()}.
     *
     * <p>The {@code stats} object is derived data and is recomputed.</p>
     *
     * @param json the JSON document
     * @return the graph
     */
    public static ProjectGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");

        try {
            final JsonNode node = MAPPER.readTree(json);
            final List<ModuleRecord> modules = MAPPER.convertValue(
                    node.get("modules"),
                    new TypeReference<List<ModuleRecord>>() {});
            final List<Edge> edges = MAPPER.convertValue(
                    node.get("edges"),
                    new TypeReference<List<Edge>>() {});
            return new ProjectGraph(node.path("root").asText(""),
                    modules == null ? List.of() : modules,
                    edges == null ? List.of() : edges);
        } catch (final JsonProcessingException | IllegalArgumentException e) {
            throw new DomainException("Failed to deserialize project graph",
                    "SERIALIZATION_ERROR", e);
        }
    }

}

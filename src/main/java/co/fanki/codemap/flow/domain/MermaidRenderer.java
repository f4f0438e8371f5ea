package co.fanki.codemap.flow.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders flow steps as a top-down Mermaid flowchart.
 *
 * <p>The output lists every node with its style class assignment, then
 * every link, then one {@code classDef} per step kind.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MermaidRenderer {

    private static final String INDENT = "    ";

    private MermaidRenderer() {
    }

    /**
     * Renders the steps.
     *
     * @param steps the steps in id order
     * @return the Mermaid source, ending with a line break
     */
    public static String render(final List<FlowStep> steps) {
        final List<String> lines = new ArrayList<>();
        lines.add("flowchart TD");
        final List<String> links = new ArrayList<>();
        for (final FlowStep step : steps) {
            lines.add(INDENT + node(step));
            lines.add(INDENT + "class " + step.sid() + " "
                    + step.kind().styleClass());
            if (!step.isRoot()) {
                links.add(INDENT + "n" + step.parent() + " --> "
                        + step.sid());
            }
        }
        lines.addAll(links);

        final StringBuilder out = new StringBuilder(String.join("\n", lines));
        out.append('\n');
        for (final FlowKind kind : FlowKind.values()) {
            out.append(INDENT).append("classDef ").append(kind.styleClass())
                    .append(' ').append(kind.style()).append('\n');
        }
        return out.toString();
    }

    private static String node(final FlowStep step) {
        String label = MermaidLabels.escape(step.label());
        if (step.line() > 0) {
            label = label + "  L" + step.line();
        }
        return step.sid() + step.kind().shapeOpen() + "\"" + label + "\""
                + step.kind().shapeClose();
    }

}

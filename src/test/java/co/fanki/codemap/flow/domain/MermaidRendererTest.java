package co.fanki.codemap.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for MermaidRenderer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MermaidRendererTest {

    @Test
    void whenRendering_givenSteps_shouldEmitNodesThenLinksThenStyles() {
        final List<FlowStep> steps = List.of(
                new FlowStep(1, FlowKind.START, "main.py", "Module entry", 1,
                        null, "#58a6ff"),
                new FlowStep(2, FlowKind.DEFINE, "def run(a)", "1 stmts", 3,
                        1, "#bc8cff"),
                new FlowStep(3, FlowKind.RETURN, "return \"ok\"", "", 4, 2,
                        "#f85149"));

        final String mermaid = MermaidRenderer.render(steps);

        final String expectedBody = "flowchart TD\n"
                + "    n1((\"main.py  L1\"))\n"
                + "    class n1 startStyle\n"
                + "    n2([\"def run❨a❩  L3\"])\n"
                + "    class n2 defineStyle\n"
                + "    n3[/\"return 'ok'  L4\"/]\n"
                + "    class n3 returnStyle\n"
                + "    n1 --> n2\n"
                + "    n2 --> n3\n";
        assertTrue(mermaid.startsWith(expectedBody));
        assertTrue(mermaid.contains("    classDef conditionStyle "
                + "fill:#3a2a1a,stroke:#d29922,stroke-width:1px,"
                + "color:#d29922\n"));
        assertTrue(mermaid.endsWith("    classDef returnStyle "
                + "fill:#2a1a1a,stroke:#f85149,stroke-width:1px,"
                + "color:#f85149\n"));
    }

    @Test
    void whenRendering_givenStepWithoutLine_shouldOmitLineSuffix() {
        final String mermaid = MermaidRenderer.render(List.of(
                new FlowStep(1, FlowKind.START, "a.py", "", 0, null, "")));

        assertTrue(mermaid.contains("    n1((\"a.py\"))\n"));
    }

    @Test
    void whenRendering_givenNoSteps_shouldStillDeclareEveryStyle() {
        final String mermaid = MermaidRenderer.render(List.of());

        final long classDefs = mermaid.lines()
                .filter(line -> line.startsWith("    classDef "))
                .count();
        assertTrue(mermaid.startsWith("flowchart TD\n"));
        assertEquals(FlowKind.values().length, classDefs);
    }

}

package co.fanki.codemap.flow.application;

import co.fanki.codemap.analysis.domain.SourceNotFoundException;
import co.fanki.codemap.analysis.domain.SourceSyntaxException;
import co.fanki.codemap.flow.domain.BranchingCaps;
import co.fanki.codemap.flow.domain.FlowChart;
import co.fanki.codemap.flow.domain.FlowEdge;
import co.fanki.codemap.flow.domain.FlowKind;
import co.fanki.codemap.flow.domain.FlowStep;
import co.fanki.codemap.flow.domain.FlowWalker;
import co.fanki.codemap.flow.domain.python.PythonFlowReader;
import co.fanki.codemap.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FlowVisualizationService over files on disk.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowVisualizationServiceTest {

    private FlowVisualizationService service;

    @BeforeEach
    void setUp() {
        service = new FlowVisualizationService(new PythonFlowReader(),
                new FlowWalker(BranchingCaps.defaults()));
    }

    @Test
    void whenVisualizing_givenIfElse_shouldHangElseFromTheCondition(
            @TempDir final Path root) throws IOException {
        Files.writeString(root.resolve("main.py"),
                "if x:\n    y()\nelse:\n    z()\n");

        final FlowChart chart = service.visualize(root, "main.py");

        final List<FlowStep> steps = chart.steps();
        assertEquals(5, chart.totalSteps());
        assertStep(steps.get(0), FlowKind.START, "main.py", null);
        assertStep(steps.get(1), FlowKind.CONDITION, "if x", 1);
        assertStep(steps.get(2), FlowKind.CALL, "y(...)", 2);
        assertStep(steps.get(3), FlowKind.CONDITION, "else", 2);
        assertStep(steps.get(4), FlowKind.CALL, "z(...)", 4);
        assertEquals(4, steps.get(3).line());

        assertEquals(List.of(new FlowEdge(1, 2), new FlowEdge(2, 3),
                new FlowEdge(2, 4), new FlowEdge(4, 5)), chart.edges());
        assertTrue(chart.mermaid().contains("    n4{\"else  L4\"}\n"));
        assertTrue(chart.mermaid().contains("    n2 --> n4\n"));
    }

    @Test
    void whenVisualizing_givenLongFunction_shouldCapItsBody(
            @TempDir final Path root) throws IOException {
        final StringBuilder source = new StringBuilder("def run(a, b):\n");
        for (int i = 0; i < 9; i++) {
            source.append("    step").append(i).append("()\n");
        }
        Files.writeString(root.resolve("jobs.py"), source.toString());

        final FlowChart chart = service.visualize(root, "jobs.py");

        assertEquals(8, chart.totalSteps());
        assertEquals("def run(a, b)", chart.steps().get(1).label());
        assertEquals("9 stmts", chart.steps().get(1).detail());
        assertEquals("step5(...)", chart.steps().get(7).label());
    }

    @Test
    void whenVisualizing_givenFileInSubdirectory_shouldNameStartAfterFile(
            @TempDir final Path root) throws IOException {
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/mod.py"), "import os\n");

        final FlowChart chart = service.visualize(root, "pkg/mod.py");

        assertEquals("pkg/mod.py", chart.file());
        assertEquals("mod.py", chart.steps().get(0).label());
        assertEquals("import os", chart.steps().get(1).label());
    }

    @Test
    void whenVisualizing_givenStandaloneFile_shouldResolveAgainstItsDirectory(
            @TempDir final Path root) throws IOException {
        final Path file = root.resolve("solo.py");
        Files.writeString(file, "");

        final FlowChart chart = service.visualize(file);

        assertEquals("solo.py", chart.file());
        assertEquals(1, chart.totalSteps());
        assertTrue(chart.edges().isEmpty());
    }

    // -- failures ----------------------------------------------------------

    @Test
    void whenVisualizing_givenSyntaxError_shouldFail(
            @TempDir final Path root) throws IOException {
        Files.writeString(root.resolve("bad.py"), "def f(:\n    pass\n");

        assertThrows(SourceSyntaxException.class,
                () -> service.visualize(root, "bad.py"));
    }

    @Test
    void whenVisualizing_givenPathOutsideRoot_shouldBlockTraversal(
            @TempDir final Path root) throws IOException {
        final Path project = Files.createDirectories(root.resolve("project"));
        Files.writeString(root.resolve("secret.py"), "x = 1\n");

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.visualize(project, "../secret.py"));

        assertEquals("PATH_TRAVERSAL", ex.getErrorCode());
    }

    @Test
    void whenVisualizing_givenMissingFile_shouldThrowNotFound(
            @TempDir final Path root) {
        final SourceNotFoundException ex = assertThrows(
                SourceNotFoundException.class,
                () -> service.visualize(root, "missing.py"));

        assertEquals("File not found: missing.py", ex.getMessage());
    }

    private static void assertStep(final FlowStep step, final FlowKind kind,
            final String label, final Integer parent) {
        assertEquals(kind, step.kind());
        assertEquals(label, step.label());
        assertEquals(parent, step.parent());
    }

}

package co.fanki.codemap.flow.application;

import co.fanki.codemap.analysis.domain.SourceFile;
import co.fanki.codemap.analysis.domain.SourceNotFoundException;
import co.fanki.codemap.analysis.domain.SourceReader;
import co.fanki.codemap.analysis.domain.SourceSyntaxException;
import co.fanki.codemap.flow.domain.FlowChart;
import co.fanki.codemap.flow.domain.FlowReader;
import co.fanki.codemap.flow.domain.FlowStatement;
import co.fanki.codemap.flow.domain.FlowStep;
import co.fanki.codemap.flow.domain.FlowWalker;
import co.fanki.codemap.flow.domain.MermaidRenderer;
import co.fanki.codemap.shared.DomainException;
import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Draws the execution flow of a single source file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FlowVisualizationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowVisualizationService.class);

    private final FlowReader reader;

    private final FlowWalker walker;

    /**
     * Creates a new FlowVisualizationService.
     *
     * @param theReader the reader turning source into flow statements
     * @param theWalker the walker numbering and capping the steps
     */
    public FlowVisualizationService(final FlowReader theReader,
            final FlowWalker theWalker) {
        this.reader = Preconditions.requireNonNull(theReader,
                "Reader is required");
        this.walker = Preconditions.requireNonNull(theWalker,
                "Walker is required");
    }

    /**
     * Draws a file on its own.
     *
     * @param file the source file
     * @return the flow chart, named after the file
     */
    public FlowChart visualize(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        final Path absolute = file.toAbsolutePath().normalize();
        final Path parent = Preconditions.requireNonNull(absolute.getParent(),
                "File must have a parent directory");
        return visualize(parent, absolute.getFileName().toString());
    }

    /**
     * Draws a file of a project.
     *
     * @param projectRoot the project root
     * @param relativePath the file path relative to the root
     * @return the flow chart
     * @throws DomainException with code {@code PATH_TRAVERSAL} if the path
     *         points outside the root
     * @throws SourceNotFoundException if the file does not exist
     * @throws SourceSyntaxException if the file does not parse
     */
    public FlowChart visualize(final Path projectRoot,
            final String relativePath) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonBlank(relativePath, "File path is required");

        final Path root = projectRoot.toAbsolutePath().normalize();
        final Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root)) {
            throw new DomainException("Path traversal blocked: "
                    + relativePath, "PATH_TRAVERSAL");
        }
        if (!Files.isRegularFile(file)) {
            throw new SourceNotFoundException("File not found: "
                    + relativePath);
        }

        final SourceFile source;
        try {
            source = SourceReader.read(file, root);
        } catch (final IOException e) {
            throw new DomainException("Could not read " + relativePath,
                    "READ_ERROR", e);
        }

        final List<FlowStatement> statements = reader.read(source);
        final List<FlowStep> steps = walker.walk(source.displayName(),
                statements);
        final FlowChart chart = FlowChart.of(relativePath.replace('\\', '/'),
                steps, MermaidRenderer.render(steps));

        LOG.info("Visualized {}: {} steps", chart.file(), chart.totalSteps());

        return chart;
    }

}

package co.fanki.codemap.analysis.application;

import co.fanki.codemap.analysis.domain.CallResolver;
import co.fanki.codemap.analysis.domain.Edge;
import co.fanki.codemap.analysis.domain.KeywordExtractor;
import co.fanki.codemap.analysis.domain.ModuleRecord;
import co.fanki.codemap.analysis.domain.ModuleSearch;
import co.fanki.codemap.analysis.domain.ProjectGraph;
import co.fanki.codemap.analysis.domain.ProjectScanner;
import co.fanki.codemap.analysis.domain.ScanResult;
import co.fanki.codemap.analysis.domain.SourceNotFoundException;
import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Builds project graphs and answers keyword searches over them.
 *
 * <p>Every call works from scratch: the tree is scanned again, a new
 * symbol index is built and nothing is kept between calls, so concurrent
 * calls never share state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectAnalysisService.class);

    private final ProjectScanner scanner;

    private final CallResolver callResolver;

    /**
     * Creates a new ProjectAnalysisService.
     *
     * @param theScanner the project scanner
     * @param theCallResolver the call resolver turning calls into edges
     */
    public ProjectAnalysisService(final ProjectScanner theScanner,
            final CallResolver theCallResolver) {
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
        this.callResolver = Preconditions.requireNonNull(theCallResolver,
                "Call resolver is required");
    }

    /**
     * Analyzes a project directory.
     *
     * <p>Files that cannot be read or parsed show up as error-flagged
     * modules; they never fail the analysis.</p>
     *
     * @param projectRoot the project root directory
     * @return the project graph
     * @throws SourceNotFoundException if the root is not a directory
     */
    public ProjectGraph analyze(final Path projectRoot) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        if (!Files.isDirectory(projectRoot)) {
            throw new SourceNotFoundException(
                    "Project root not found: " + projectRoot);
        }
        final Path root = projectRoot.toAbsolutePath().normalize();

        final ScanResult scan = scanner.scan(root);
        final List<Edge> edges = callResolver.resolve(scan.modules(),
                scan.symbols());
        final ProjectGraph graph = new ProjectGraph(root.toString(),
                scan.modules(), edges);

        LOG.info("Analyzed {}: {} modules, {} functions, {} classes,"
                + " {} edges", graph.root(), graph.stats().totalModules(),
                graph.stats().totalFunctions(), graph.stats().totalClasses(),
                edges.size());

        return graph;
    }

    /**
     * Analyzes a single file of a project.
     *
     * @param file the source file
     * @param projectRoot the root the module path is made relative to
     * @return the module record, error-flagged if the file does not parse
     * @throws SourceNotFoundException if the file does not exist
     */
    public ModuleRecord analyzeFile(final Path file, final Path projectRoot) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        if (!Files.isRegularFile(file)) {
            throw new SourceNotFoundException("File not found: " + file);
        }
        return scanner.scanFile(file, projectRoot);
    }

    /**
     * Finds the modules whose path, function names or class names contain
     * any of the keywords, ignoring case.
     *
     * @param graph the project graph
     * @param keywords the keywords
     * @return the matching modules in graph order
     */
    public List<ModuleRecord> search(final ProjectGraph graph,
            final Collection<String> keywords) {
        return ModuleSearch.search(graph, keywords);
    }

    /**
     * Finds the modules relevant to a free-text question.
     *
     * @param graph the project graph
     * @param question the question, e.g. "where are orders validated?"
     * @return the matching modules in graph order
     */
    public List<ModuleRecord> searchByQuestion(final ProjectGraph graph,
            final String question) {
        final List<String> keywords = KeywordExtractor.extract(question);
        LOG.debug("Question keywords: {}", keywords);
        return search(graph, keywords);
    }

}

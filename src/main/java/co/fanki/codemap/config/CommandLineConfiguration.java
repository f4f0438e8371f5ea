package co.fanki.codemap.config;

import co.fanki.codemap.analysis.application.ProjectAnalysisService;
import co.fanki.codemap.analysis.domain.ModuleRecord;
import co.fanki.codemap.analysis.domain.ProjectGraph;
import co.fanki.codemap.flow.application.FlowVisualizationService;
import co.fanki.codemap.shared.DomainException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Exposes the analysis operations as a command line tool printing JSON
 * to standard output.
 *
 * <p>Enabled with {@code codemap.cli.enabled=true}. Commands:</p>
 * <ul>
 *   <li>{@code analyze <root>}: the project graph</li>
 *   <li>{@code visualize <root> <file>}: the flow chart of one file</li>
 *   <li>{@code search <root> <keyword>...}: matching modules</li>
 *   <li>{@code ask <root> <question>}: modules relevant to a question</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "codemap.cli.enabled", havingValue = "true")
public class CommandLineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            CommandLineConfiguration.class);

    private static final String USAGE = "usage: analyze <root> | visualize"
            + " <root> <file> | search <root> <keyword>... | ask <root>"
            + " <question>";

    /**
     * Creates the runner dispatching the command line.
     *
     * @param analysisService the project analysis service
     * @param flowService the flow visualization service
     * @param objectMapper the mapper used for search results
     * @return the command line runner
     */
    @Bean
    CommandLineRunner codeMapCommandLine(
            final ProjectAnalysisService analysisService,
            final FlowVisualizationService flowService,
            final ObjectMapper objectMapper) {
        return args -> {
            try {
                System.out.println(run(args, analysisService, flowService,
                        objectMapper));
            } catch (final DomainException e) {
                LOG.error("{} failed [{}]: {}", args.length > 0 ? args[0]
                        : "command", e.getErrorCode(), e.getMessage());
                System.err.println(e.getMessage());
            }
        };
    }

    static String run(final String[] args,
            final ProjectAnalysisService analysisService,
            final FlowVisualizationService flowService,
            final ObjectMapper objectMapper) {
        if (args.length < 2) {
            throw new DomainException(USAGE, "USAGE");
        }
        final Path root = Path.of(args[1]);
        final List<String> rest = Arrays.asList(args).subList(2, args.length);

        return switch (args[0]) {
            case "analyze" -> analysisService.analyze(root).toJson();
            case "visualize" -> {
                if (rest.size() != 1) {
                    throw new DomainException(USAGE, "USAGE");
                }
                yield flowService.visualize(root, rest.get(0)).toJson();
            }
            case "search" -> json(objectMapper, analysisService.search(
                    analysisService.analyze(root), rest));
            case "ask" -> {
                final ProjectGraph graph = analysisService.analyze(root);
                yield json(objectMapper, analysisService.searchByQuestion(
                        graph, String.join(" ", rest)));
            }
            default -> throw new DomainException(USAGE, "USAGE");
        };
    }

    private static String json(final ObjectMapper objectMapper,
            final List<ModuleRecord> modules) {
        try {
            return objectMapper.writeValueAsString(modules);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to serialize search results",
                    "SERIALIZATION_ERROR", e);
        }
    }

}

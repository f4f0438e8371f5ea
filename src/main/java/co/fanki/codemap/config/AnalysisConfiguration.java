package co.fanki.codemap.config;

import co.fanki.codemap.analysis.domain.CallResolver;
import co.fanki.codemap.analysis.domain.NameOnlyCallResolver;
import co.fanki.codemap.analysis.domain.ProjectScanner;
import co.fanki.codemap.analysis.domain.SourceParser;
import co.fanki.codemap.analysis.domain.python.PythonSourceParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the project analysis pipeline for Python sources.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    /**
     * Provides the Python source parser.
     *
     * @return the parser
     */
    @Bean
    public SourceParser pythonSourceParser() {
        return new PythonSourceParser();
    }

    /**
     * Creates the project scanner.
     *
     * @param parser the source parser applied to each file
     * @param excludedDirectories names skipped at every level, on top of
     *        hidden entries
     * @return the scanner
     */
    @Bean
    public ProjectScanner projectScanner(final SourceParser parser,
            @Value("${codemap.scan.excluded-directories:"
                    + "__pycache__,venv,node_modules}")
            final String[] excludedDirectories) {
        return new ProjectScanner(parser, List.of(excludedDirectories));
    }

    /**
     * Provides the name-only call resolver.
     *
     * @return the resolver
     */
    @Bean
    public CallResolver callResolver() {
        return new NameOnlyCallResolver();
    }

}

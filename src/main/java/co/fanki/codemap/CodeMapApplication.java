package co.fanki.codemap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Map Application.
 *
 * <p>Entry point for the code map core: it scans Python projects into a
 * cross-file call graph, searches that graph by keyword and draws the
 * execution flow of single files as Mermaid diagrams.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CodeMapApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeMapApplication.class, args);
    }

}

package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Abstract strategy for extracting structural facts from one source file.
 *
 * <p>Each programming language has its own syntax tree and its own notion
 * of functions, classes, imports and calls. Subclasses implement
 * {@link #extract(SourceFile)} for their language, while this class
 * provides the template method {@link #parse(Path, Path)} that reads the
 * file and hands it over.</p>
 *
 * <p>Extraction never fails on a file that reads: a file that does not
 * parse yields an error-flagged, empty {@link ModuleRecord}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParser.class);

    /**
     * Returns the language identifier for this parser.
     *
     * @return the language name (e.g., "python")
     */
    public abstract String language();

    /**
     * Returns the extension of the files this parser handles.
     *
     * @return the extension including the dot (e.g., ".py")
     */
    public abstract String fileExtension();

    /**
     * Extracts functions, classes, imports and calls from a source file.
     *
     * @param source the source file
     * @return the module record, error-flagged if the text does not parse
     */
    public abstract ModuleRecord extract(SourceFile source);

    /**
     * Checks whether a file name carries this parser's extension.
     *
     * @param fileName the file name
     * @return true if the file is a source file for this language
     */
    public boolean accepts(final String fileName) {
        return fileName != null && fileName.endsWith(fileExtension());
    }

    /**
     * Reads and extracts a single file.
     *
     * @param file the file to parse
     * @param projectRoot the root the module path is made relative to
     * @return the module record
     * @throws IOException if the file cannot be read
     */
    public ModuleRecord parse(final Path file, final Path projectRoot)
            throws IOException {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        final SourceFile source = SourceReader.read(file, projectRoot);
        final ModuleRecord module = extract(source);

        LOG.debug("Parsed {} module {}: {} functions, {} classes, {} calls",
                language(), module.path(), module.functions().size(),
                module.classes().size(), module.calls().size());

        return module;
    }

}

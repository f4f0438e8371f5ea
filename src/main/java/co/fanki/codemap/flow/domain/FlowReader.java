package co.fanki.codemap.flow.domain;

import co.fanki.codemap.analysis.domain.SourceFile;

import java.util.List;

/**
 * Reads the top-level statements of a source file for a flow diagram.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FlowReader {

    /**
     * Reads a file.
     *
     * @param source the source file
     * @return the module-level statements, in order
     * @throws co.fanki.codemap.analysis.domain.SourceSyntaxException if
     *         the file does not parse
     */
    List<FlowStatement> read(SourceFile source);

}

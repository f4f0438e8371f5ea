package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.DomainException;

/**
 * Raised when the single target file of a request is not valid source.
 *
 * <p>During a project scan syntax errors are embedded in the module
 * records instead; this exception is only thrown where the broken file is
 * the whole request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceSyntaxException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final int line;

    /**
     * Creates a new syntax exception.
     *
     * @param message the parser message
     * @param theLine the 1-based line of the first problem
     */
    public SourceSyntaxException(final String message, final int theLine) {
        super("Syntax error: " + message, "SYNTAX_ERROR");
        this.line = theLine;
    }

    /**
     * Returns the line of the first syntax problem.
     *
     * @return the 1-based line number
     */
    public int getLine() {
        return line;
    }

}

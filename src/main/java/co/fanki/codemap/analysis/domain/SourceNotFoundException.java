package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.DomainException;

/**
 * Raised when a requested project root or source file does not exist or
 * is not of the expected type.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceNotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new not-found exception.
     *
     * @param message the error message naming the missing path
     */
    public SourceNotFoundException(final String message) {
        super(message, "NOT_FOUND");
    }

}

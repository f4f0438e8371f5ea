package co.fanki.codemap.flow.domain;

import co.fanki.codemap.shared.Preconditions;

/**
 * Limits on how much of each construct a flow diagram shows.
 *
 * <p>Body caps count statements, shown or not, from the top of the body.
 * Statements past a cap are dropped without a marker. Label caps bound
 * the names listed in a single label. Module-level statements are never
 * capped.</p>
 *
 * @param functionBody statements shown under a function
 * @param classBody statements shown under a class
 * @param block statements shown under a branch, loop, try or with
 * @param handlers handlers shown under a try
 * @param handlerBody statements shown under a handler
 * @param functionParameters parameters listed in a function label
 * @param classBases bases listed in a class label
 * @param importNames names listed in an import label
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BranchingCaps(
        int functionBody,
        int classBody,
        int block,
        int handlers,
        int handlerBody,
        int functionParameters,
        int classBases,
        int importNames
) {

    /** Validates that every cap is non-negative. */
    public BranchingCaps {
        Preconditions.requireNonNegative(functionBody,
                "Function body cap must not be negative");
        Preconditions.requireNonNegative(classBody,
                "Class body cap must not be negative");
        Preconditions.requireNonNegative(block,
                "Block cap must not be negative");
        Preconditions.requireNonNegative(handlers,
                "Handler cap must not be negative");
        Preconditions.requireNonNegative(handlerBody,
                "Handler body cap must not be negative");
        Preconditions.requireNonNegative(functionParameters,
                "Parameter cap must not be negative");
        Preconditions.requireNonNegative(classBases,
                "Base class cap must not be negative");
        Preconditions.requireNonNegative(importNames,
                "Import name cap must not be negative");
    }

    /**
     * Returns the stock caps.
     *
     * @return function 6, class 5, block 3, handlers 2, handler body 2,
     *         parameters 4, bases 2, import names 3
     */
    public static BranchingCaps defaults() {
        return new BranchingCaps(6, 5, 3, 2, 2, 4, 2, 3);
    }

}

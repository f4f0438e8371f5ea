package co.fanki.codemap.analysis.domain;

import java.util.List;

/**
 * Turns the call names recorded in each module into module-to-module
 * edges.
 *
 * <p>Kept apart from extraction so that a more precise resolver can
 * replace the name-only heuristic without touching the parsers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CallResolver {

    /**
     * Resolves the calls of every module.
     *
     * @param modules the scanned modules in traversal order
     * @param symbols the function name index built during the scan
     * @return the edges, never containing a self edge
     */
    List<Edge> resolve(List<ModuleRecord> modules, SymbolIndex symbols);

}

package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.List;

/**
 * The outcome of a project scan: the modules in traversal order and the
 * symbol index built while scanning them.
 *
 * @param modules the scanned modules, failed ones included
 * @param symbols the function name index
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScanResult(
        List<ModuleRecord> modules,
        SymbolIndex symbols
) {

    /** Freezes the module list. */
    public ScanResult {
        modules = List.copyOf(Preconditions.requireNonNull(modules,
                "Modules are required"));
        Preconditions.requireNonNull(symbols, "Symbol index is required");
    }

}

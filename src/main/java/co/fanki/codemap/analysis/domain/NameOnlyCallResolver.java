package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Best-effort call resolution by base name only.
 *
 * <p>For each call name of a module, the segment before the first dot is
 * looked up in the {@link SymbolIndex}. A hit owned by another module
 * yields one edge labeled with the full call name. Calls resolving to the
 * calling module itself, and calls to names the index does not know
 * (built-ins, third-party functions, methods on instances), yield
 * nothing.</p>
 *
 * <p>There is no scope or type awareness: unrelated modules declaring
 * helpers with the same name produce false edges, and calls routed
 * through objects are missed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NameOnlyCallResolver implements CallResolver {

    /** {@inheritDoc} */
    @Override
    public List<Edge> resolve(final List<ModuleRecord> modules,
            final SymbolIndex symbols) {

        Preconditions.requireNonNull(modules, "Modules are required");
        Preconditions.requireNonNull(symbols, "Symbol index is required");

        final List<Edge> edges = new ArrayList<>();
        for (final ModuleRecord module : modules) {
            for (final String call : module.calls()) {
                final Optional<String> target = symbols.owner(baseName(call));
                if (target.isPresent()
                        && !target.get().equals(module.path())) {
                    edges.add(new Edge(module.path(), target.get(), call));
                }
            }
        }
        return edges;
    }

    private static String baseName(final String call) {
        final int dot = call.indexOf('.');
        return dot < 0 ? call : call.substring(0, dot);
    }

}

package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a function's simple name to the one module that owns it.
 *
 * <p>Built fresh for every scan. When several modules declare a function
 * with the same name, the module registered last wins and the earlier
 * owners are forgotten. Registration follows scan order, so the owner of
 * a colliding name is the module that comes last in traversal order. This
 * makes call resolution order dependent and is a known source of false
 * edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SymbolIndex {

    private static final Logger LOG = LoggerFactory.getLogger(
            SymbolIndex.class);

    private final Map<String, String> owners = new LinkedHashMap<>();

    /**
     * Registers a module as the owner of a function name.
     *
     * @param functionName the simple function name
     * @param modulePath the declaring module path
     */
    public void register(final String functionName, final String modulePath) {
        Preconditions.requireNonBlank(functionName,
                "Function name is required");
        Preconditions.requireNonBlank(modulePath, "Module path is required");

        final String previous = owners.put(functionName, modulePath);
        if (previous != null && !previous.equals(modulePath)) {
            LOG.debug("Function {} now owned by {} instead of {}",
                    functionName, modulePath, previous);
        }
    }

    /**
     * Registers every function of a module.
     *
     * @param module the scanned module
     */
    public void registerAll(final ModuleRecord module) {
        Preconditions.requireNonNull(module, "Module is required");
        for (final FunctionRecord function : module.functions()) {
            register(function.name(), module.path());
        }
    }

    /**
     * Looks up the owner of a function name.
     *
     * @param functionName the simple function name
     * @return the owning module path, empty if unknown
     */
    public Optional<String> owner(final String functionName) {
        return Optional.ofNullable(owners.get(functionName));
    }

    /**
     * Returns the number of distinct names.
     *
     * @return the name count
     */
    public int size() {
        return owners.size();
    }

}

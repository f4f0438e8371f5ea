package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Finds the modules of a graph whose names match any of a set of
 * keywords.
 *
 * <p>Case-insensitive substring matching on the module path, then on the
 * declared function names, then on the declared class names. The first
 * hit includes the module; there is no scoring, and the result keeps the
 * graph's module order with each module at most once.</p>
 *
 * <p>Keywords are used as given: an empty keyword is a substring of every
 * name and so matches every module, while a keyword of spaces only matches
 * names containing them. No keywords at all match nothing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleSearch {

    private ModuleSearch() {
    }

    /**
     * Searches a graph.
     *
     * @param graph the built project graph
     * @param keywords the keywords, null entries are ignored
     * @return the matching modules in graph order
     */
    public static List<ModuleRecord> search(final ProjectGraph graph,
            final Collection<String> keywords) {

        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(keywords, "Keywords are required");

        final List<String> needles = new ArrayList<>();
        for (final String keyword : keywords) {
            if (keyword != null) {
                needles.add(keyword.toLowerCase(Locale.ROOT));
            }
        }
        if (needles.isEmpty()) {
            return List.of();
        }

        final List<ModuleRecord> results = new ArrayList<>();
        for (final ModuleRecord module : graph.modules()) {
            if (matches(module, needles)) {
                results.add(module);
            }
        }
        return results;
    }

    private static boolean matches(final ModuleRecord module,
            final List<String> needles) {
        if (containsAny(module.path(), needles)) {
            return true;
        }
        for (final FunctionRecord function : module.functions()) {
            if (containsAny(function.name(), needles)) {
                return true;
            }
        }
        for (final ClassRecord type : module.classes()) {
            if (containsAny(type.name(), needles)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(final String name,
            final List<String> needles) {
        final String haystack = name.toLowerCase(Locale.ROOT);
        for (final String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

}

package co.fanki.codemap.analysis.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate counts over the modules of a project graph.
 *
 * @param totalModules the number of scanned modules, failed ones included
 * @param totalFunctions the number of functions over all modules
 * @param totalClasses the number of classes over all modules
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectStats(
        @JsonProperty("total_modules") int totalModules,
        @JsonProperty("total_functions") int totalFunctions,
        @JsonProperty("total_classes") int totalClasses
) {

    /**
     * Computes the counts for a list of modules.
     *
     * @param modules the scanned modules
     * @return the aggregate counts
     */
    public static ProjectStats of(final List<ModuleRecord> modules) {
        int functions = 0;
        int classes = 0;
        for (final ModuleRecord module : modules) {
            functions += module.functions().size();
            classes += module.classes().size();
        }
        return new ProjectStats(modules.size(), functions, classes);
    }

}

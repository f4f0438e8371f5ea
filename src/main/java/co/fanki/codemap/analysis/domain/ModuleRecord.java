package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The structural facts extracted from one source file.
 *
 * <p>A module either parsed fully or failed: a failed module carries an
 * error marker and no functions, classes, imports or calls. Imports and
 * calls are distinct and keep the order of their first occurrence in the
 * file.</p>
 *
 * @param path the file path relative to the project root, forward slashes
 * @param functions every function declared in the file, methods included
 * @param classes every class declared in the file
 * @param imports the distinct imported module names
 * @param calls the distinct dotted call names
 * @param error the error marker, null when the file parsed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModuleRecord(
        @JsonProperty("module") String path,
        @JsonProperty("functions") List<FunctionRecord> functions,
        @JsonProperty("classes") List<ClassRecord> classes,
        @JsonProperty("imports")
        @JsonDeserialize(as = LinkedHashSet.class) Set<String> imports,
        @JsonProperty("calls")
        @JsonDeserialize(as = LinkedHashSet.class) Set<String> calls,
        @JsonProperty("error") String error
) {

    /** Marker for a file whose text is not valid source. */
    public static final String PARSE_ERROR = "SyntaxError - could not parse";

    /** Marker for a file that could not be read from disk. */
    public static final String READ_ERROR = "IOError - could not read file";

    /** Freezes the collections and enforces the failed-module shape. */
    public ModuleRecord {
        Preconditions.requireNonBlank(path, "Module path is required");
        functions = List.copyOf(Preconditions.requireNonNull(functions,
                "Functions are required"));
        classes = List.copyOf(Preconditions.requireNonNull(classes,
                "Classes are required"));
        imports = frozen(Preconditions.requireNonNull(imports,
                "Imports are required"));
        calls = frozen(Preconditions.requireNonNull(calls,
                "Calls are required"));
        if (error != null) {
            Preconditions.require(functions.isEmpty() && classes.isEmpty()
                    && imports.isEmpty() && calls.isEmpty(),
                    "A failed module cannot carry extracted facts");
        }
    }

    /**
     * Creates the record of a file that parsed.
     *
     * @param path the relative file path
     * @param functions the declared functions
     * @param classes the declared classes
     * @param imports the imported module names
     * @param calls the dotted call names
     * @return the module record
     */
    public static ModuleRecord parsed(final String path,
            final List<FunctionRecord> functions,
            final List<ClassRecord> classes,
            final Collection<String> imports,
            final Collection<String> calls) {
        return new ModuleRecord(path, functions, classes,
                new LinkedHashSet<>(imports), new LinkedHashSet<>(calls),
                null);
    }

    /**
     * Creates the empty, error-flagged record of a file that failed.
     *
     * @param path the relative file path
     * @param error the error marker
     * @return the module record
     */
    public static ModuleRecord failed(final String path, final String error) {
        Preconditions.requireNonBlank(error, "Error marker is required");
        return new ModuleRecord(path, List.of(), List.of(), Set.of(),
                Set.of(), error);
    }

    /**
     * Checks whether this module failed to parse or to be read.
     *
     * @return true if the error marker is set
     */
    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    private static Set<String> frozen(final Collection<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

}

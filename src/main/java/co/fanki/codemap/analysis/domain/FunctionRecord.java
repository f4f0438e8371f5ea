package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A function declaration found anywhere in a module, including methods
 * and nested functions.
 *
 * <p>The name is the simple name as written in the declaration, never
 * qualified by the enclosing scope.</p>
 *
 * @param name the simple function name
 * @param file the owning module path, relative to the project root
 * @param startLine the 1-based line of the declaration keyword
 * @param endLine the 1-based last line of the body, inclusive
 * @param args the ordinary positional parameter names, in order
 * @param decorators the simple decorator names, in order
 * @param docstring the cleaned docstring, empty if absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionRecord(
        @JsonProperty("name") String name,
        @JsonProperty("file") String file,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("args") List<String> args,
        @JsonProperty("decorators") List<String> decorators,
        @JsonProperty("docstring") String docstring
) {

    /** Validates line bounds and freezes the collections. */
    public FunctionRecord {
        Preconditions.requireNonBlank(name, "Function name is required");
        Preconditions.requireNonBlank(file, "Owning file is required");
        Preconditions.requirePositive(startLine,
                "Start line must be positive");
        Preconditions.require(startLine <= endLine,
                "End line must not precede start line");
        args = List.copyOf(Preconditions.requireNonNull(args,
                "Arguments are required"));
        decorators = List.copyOf(Preconditions.requireNonNull(decorators,
                "Decorators are required"));
        docstring = docstring == null ? "" : docstring;
    }

}

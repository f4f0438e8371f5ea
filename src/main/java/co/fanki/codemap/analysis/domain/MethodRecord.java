package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A function declaration reported as a method of a class.
 *
 * <p>Same shape as {@link FunctionRecord} minus the decorators.</p>
 *
 * @param name the simple method name
 * @param file the owning module path, relative to the project root
 * @param startLine the 1-based line of the declaration keyword
 * @param endLine the 1-based last line of the body, inclusive
 * @param args the ordinary positional parameter names, in order
 * @param docstring the cleaned docstring, empty if absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MethodRecord(
        @JsonProperty("name") String name,
        @JsonProperty("file") String file,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("args") List<String> args,
        @JsonProperty("docstring") String docstring
) {

    /** Validates line bounds and freezes the parameter list. */
    public MethodRecord {
        Preconditions.requireNonBlank(name, "Method name is required");
        Preconditions.requireNonBlank(file, "Owning file is required");
        Preconditions.requirePositive(startLine,
                "Start line must be positive");
        Preconditions.require(startLine <= endLine,
                "End line must not precede start line");
        args = List.copyOf(Preconditions.requireNonNull(args,
                "Arguments are required"));
        docstring = docstring == null ? "" : docstring;
    }

    /**
     * Creates the method view of a function declaration.
     *
     * @param function the function declared inside a class body
     * @return the method record
     */
    public static MethodRecord of(final FunctionRecord function) {
        Preconditions.requireNonNull(function, "Function is required");
        return new MethodRecord(function.name(), function.file(),
                function.startLine(), function.endLine(), function.args(),
                function.docstring());
    }

}

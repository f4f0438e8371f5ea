package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A class declaration and every function declared anywhere in its body.
 *
 * <p>Methods are gathered from the whole subtree of the class, so a
 * function declared inside a nested helper class or a closure is also
 * reported as a method of the outer class.</p>
 *
 * @param name the simple class name
 * @param file the owning module path, relative to the project root
 * @param startLine the 1-based line of the {@code class} keyword
 * @param endLine the 1-based last line of the body, inclusive
 * @param docstring the cleaned docstring, empty if absent
 * @param methods the methods in breadth-first order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassRecord(
        @JsonProperty("name") String name,
        @JsonProperty("file") String file,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("methods") List<MethodRecord> methods
) {

    /** Validates line bounds and freezes the method list. */
    public ClassRecord {
        Preconditions.requireNonBlank(name, "Class name is required");
        Preconditions.requireNonBlank(file, "Owning file is required");
        Preconditions.requirePositive(startLine,
                "Start line must be positive");
        Preconditions.require(startLine <= endLine,
                "End line must not precede start line");
        docstring = docstring == null ? "" : docstring;
        methods = List.copyOf(Preconditions.requireNonNull(methods,
                "Methods are required"));
    }

}

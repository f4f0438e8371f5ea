package co.fanki.codemap.analysis.domain.python;

import co.fanki.codemap.analysis.domain.SourceFile;
import co.fanki.codemap.shared.Preconditions;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed Python file backed by a tree-sitter syntax tree.
 *
 * <p>tree-sitter never rejects input: it recovers from bad syntax by
 * inserting {@code ERROR} and missing nodes. A file is considered not to
 * parse when its root node reports any such error. A new
 * {@link TSParser} is created per parse since parsers are not safe to
 * share between threads.</p>
 *
 * <p>The static helpers smooth over tree-sitter's conventions: absent
 * fields come back as null instead of null nodes, comments are filtered
 * out of child lists, and parenthesized expressions can be unwrapped the
 * way a Python compiler drops redundant parentheses.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonSyntaxTree {

    private static final TSLanguage PYTHON = new TreeSitterPython();

    private static final String COMMENT = "comment";

    private final SourceFile source;

    /** Owns the native memory the nodes point into. */
    private final TSTree tree;

    private final TSNode root;

    private PythonSyntaxTree(final SourceFile theSource, final TSTree theTree) {
        this.source = theSource;
        this.tree = theTree;
        this.root = theTree.getRootNode();
    }

    /**
     * Parses a Python source file.
     *
     * @param source the source file
     * @return the syntax tree, possibly containing errors
     */
    public static PythonSyntaxTree parse(final SourceFile source) {
        Preconditions.requireNonNull(source, "Source is required");

        final TSParser parser = new TSParser();
        parser.setLanguage(PYTHON);
        return new PythonSyntaxTree(source, parser.parseString(null,
                source.text()));
    }

    public SourceFile source() {
        return source;
    }

    /**
     * Returns the {@code module} node at the top of the tree.
     *
     * @return the root node
     */
    public TSNode root() {
        return root;
    }

    /**
     * Checks whether the file contains any syntax error.
     *
     * @return true if the tree holds error or missing nodes
     */
    public boolean hasSyntaxError() {
        return root.hasError();
    }

    /**
     * Returns the line of the first syntax problem.
     *
     * <p>Descends through the first erroneous child at every level until
     * reaching the error node itself.</p>
     *
     * @return the 1-based line, or 0 if the file parsed
     */
    public int syntaxErrorLine() {
        if (!hasSyntaxError()) {
            return 0;
        }
        TSNode node = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int i = 0; i < node.getChildCount(); i++) {
                final TSNode child = node.getChild(i);
                if (child != null && !child.isNull() && child.hasError()) {
                    node = child;
                    descended = true;
                    break;
                }
            }
        }
        return startLine(node);
    }

    /**
     * Describes the first syntax problem with its source line.
     *
     * @return the message, e.g. {@code invalid syntax (line 3): def f(:}
     */
    public String syntaxErrorMessage() {
        final int line = syntaxErrorLine();
        return "invalid syntax (line " + line + "): "
                + source.line(line).strip();
    }

    /**
     * Returns the source text covered by a node.
     *
     * @param node the node
     * @return the text, empty for a null node
     */
    public String text(final TSNode node) {
        if (isAbsent(node)) {
            return "";
        }
        return source.slice(node.getStartByte(), node.getEndByte());
    }

    /**
     * Returns a dotted module name with any inner whitespace dropped.
     *
     * @param name a {@code dotted_name} node, or any other node to take
     *        its text verbatim
     * @return the name, e.g. {@code os.path}
     */
    public String dottedName(final TSNode name) {
        if (!is(name, "dotted_name")) {
            return text(name);
        }
        final List<String> parts = new ArrayList<>();
        for (final TSNode part : namedChildren(name)) {
            parts.add(text(part));
        }
        return String.join(".", parts);
    }

    /**
     * Returns the ordinary positional parameter names of a function.
     *
     * <p>Those are the parameters before a bare {@code *} or
     * {@code *args}, minus the positional-only ones before {@code /}.
     * Keyword-only parameters and {@code **kwargs} are not included.</p>
     *
     * @param function a {@code function_definition} node
     * @return the names in declaration order
     */
    public List<String> positionalParameters(final TSNode function) {
        final List<String> names = new ArrayList<>();
        for (final TSNode parameter
                : namedChildren(field(function, "parameters"))) {
            switch (parameter.getType()) {
                case "identifier":
                    names.add(text(parameter));
                    break;
                case "default_parameter":
                case "typed_default_parameter":
                    final TSNode name = field(parameter, "name");
                    if (is(name, "identifier")) {
                        names.add(text(name));
                    }
                    break;
                case "typed_parameter":
                    final List<TSNode> inner = namedChildren(parameter);
                    if (inner.isEmpty() || !is(inner.get(0), "identifier")) {
                        return names;
                    }
                    names.add(text(inner.get(0)));
                    break;
                case "positional_separator":
                    names.clear();
                    break;
                case "keyword_separator":
                case "list_splat_pattern":
                case "dictionary_splat_pattern":
                    return names;
                default:
                    break;
            }
        }
        return names;
    }

    /**
     * Returns the 1-based line a node starts on.
     *
     * @param node the node
     * @return the start line
     */
    public static int startLine(final TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Returns the 1-based last line a node covers.
     *
     * <p>A node whose end point sits at column 0 of a later row ends with
     * a line break; that row is not part of it.</p>
     *
     * @param node the node
     * @return the end line, never before the start line
     */
    public static int endLine(final TSNode node) {
        final int startRow = node.getStartPoint().getRow();
        final int endRow = node.getEndPoint().getRow();
        if (endRow > startRow && node.getEndPoint().getColumn() == 0) {
            return endRow;
        }
        return endRow + 1;
    }

    /**
     * Returns the line of the last token of a node, ignoring trailing
     * comments that tree-sitter folds into indented blocks.
     *
     * @param node the node
     * @return the 1-based line of the last code token
     */
    public static int lastCodeLine(final TSNode node) {
        TSNode current = node;
        TSNode last = current;
        while (last != null) {
            last = null;
            for (int i = current.getChildCount() - 1; i >= 0; i--) {
                final TSNode child = current.getChild(i);
                if (!isAbsent(child) && !COMMENT.equals(child.getType())
                        && child.getEndByte() > child.getStartByte()) {
                    last = child;
                    break;
                }
            }
            if (last != null) {
                current = last;
            }
        }
        return Math.max(startLine(node), endLine(current));
    }

    /**
     * Returns a field child of a node.
     *
     * @param node the parent node
     * @param name the field name
     * @return the child, null when the field is absent
     */
    public static TSNode field(final TSNode node, final String name) {
        if (isAbsent(node)) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(name);
        return isAbsent(child) ? null : child;
    }

    /**
     * Returns the named children of a node, comments excluded.
     *
     * @param node the parent node, may be null
     * @return the children in source order
     */
    public static List<TSNode> namedChildren(final TSNode node) {
        final List<TSNode> children = new ArrayList<>();
        if (isAbsent(node)) {
            return children;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            if (!isAbsent(child) && !COMMENT.equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Returns the first named child of a given type.
     *
     * @param node the parent node
     * @param type the node type
     * @return the child, null if none
     */
    public static TSNode firstChildOfType(final TSNode node,
            final String type) {
        for (final TSNode child : namedChildren(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Strips redundant parentheses around an expression.
     *
     * @param node the expression, may be null
     * @return the innermost expression
     */
    public static TSNode unwrap(final TSNode node) {
        TSNode current = node;
        while (is(current, "parenthesized_expression")) {
            final List<TSNode> inner = namedChildren(current);
            if (inner.size() != 1) {
                break;
            }
            current = inner.get(0);
        }
        return current;
    }

    /**
     * Checks the type of a node.
     *
     * @param node the node, may be null
     * @param type the expected type
     * @return true if the node exists and has the type
     */
    public static boolean is(final TSNode node, final String type) {
        return !isAbsent(node) && type.equals(node.getType());
    }

    private static boolean isAbsent(final TSNode node) {
        return node == null || node.isNull();
    }

}

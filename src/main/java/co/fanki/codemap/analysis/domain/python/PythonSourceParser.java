package co.fanki.codemap.analysis.domain.python;

import co.fanki.codemap.analysis.domain.ClassRecord;
import co.fanki.codemap.analysis.domain.FunctionRecord;
import co.fanki.codemap.analysis.domain.MethodRecord;
import co.fanki.codemap.analysis.domain.ModuleRecord;
import co.fanki.codemap.analysis.domain.SourceFile;
import co.fanki.codemap.analysis.domain.SourceParser;
import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the structure of a Python module using tree-sitter.
 *
 * <p>Every function definition at any depth is reported as a function,
 * methods included. Classes list the functions of their whole subtree
 * breadth-first. Imports record module names and calls record the dotted
 * name of every callee that is a name or an attribute chain, both in
 * document order of first occurrence.</p>
 *
 * <p>A file with a syntax error yields an empty record flagged with
 * {@link ModuleRecord#PARSE_ERROR}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonSourceParser.class);

    private static final String FUNCTION = "function_definition";

    private static final String CLASS = "class_definition";

    private static final String DECORATED = "decorated_definition";

    private static final String BLOCK = "block";

    @Override
    public String language() {
        return "python";
    }

    @Override
    public String fileExtension() {
        return ".py";
    }

    @Override
    public ModuleRecord extract(final SourceFile source) {
        Preconditions.requireNonNull(source, "Source is required");

        final PythonSyntaxTree tree = PythonSyntaxTree.parse(source);
        if (tree.hasSyntaxError()) {
            LOG.debug("Syntax error in {}: {}", source.path(),
                    tree.syntaxErrorMessage());
            return ModuleRecord.failed(source.path(),
                    ModuleRecord.PARSE_ERROR);
        }
        return new Extraction(tree).run();
    }

    /** One pass over a parsed module. */
    private static final class Extraction {

        private final PythonSyntaxTree tree;

        private final String path;

        private final List<FunctionRecord> functions = new ArrayList<>();

        private final List<ClassRecord> classes = new ArrayList<>();

        private final Set<String> imports = new LinkedHashSet<>();

        private final Set<String> calls = new LinkedHashSet<>();

        Extraction(final PythonSyntaxTree theTree) {
            tree = theTree;
            path = theTree.source().path();
        }

        ModuleRecord run() {
            final Deque<TSNode> pending = new ArrayDeque<>();
            pending.push(tree.root());
            while (!pending.isEmpty()) {
                final TSNode node = pending.pop();
                visit(node);
                final List<TSNode> children =
                        PythonSyntaxTree.namedChildren(node);
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
            return ModuleRecord.parsed(path, functions, classes, imports,
                    calls);
        }

        private void visit(final TSNode node) {
            switch (node.getType()) {
                case FUNCTION:
                    functions.add(function(node));
                    break;
                case CLASS:
                    classes.add(type(node));
                    break;
                case "import_statement":
                    for (final TSNode name
                            : PythonSyntaxTree.namedChildren(node)) {
                        imports.add(tree.dottedName(
                                PythonSyntaxTree.is(name, "aliased_import")
                                        ? PythonSyntaxTree.field(name, "name")
                                        : name));
                    }
                    break;
                case "import_from_statement":
                    importFrom(PythonSyntaxTree.field(node, "module_name"));
                    break;
                case "future_import_statement":
                    imports.add("__future__");
                    break;
                case "call":
                    final String callee = callName(
                            PythonSyntaxTree.field(node, "function"));
                    if (!callee.isEmpty()) {
                        calls.add(callee);
                    }
                    break;
                default:
                    break;
            }
        }

        private void importFrom(final TSNode module) {
            if (PythonSyntaxTree.is(module, "dotted_name")) {
                imports.add(tree.dottedName(module));
            } else if (PythonSyntaxTree.is(module, "relative_import")) {
                final TSNode name = PythonSyntaxTree.firstChildOfType(module,
                        "dotted_name");
                if (name != null) {
                    imports.add(tree.dottedName(name));
                }
            }
        }

        private FunctionRecord function(final TSNode node) {
            return new FunctionRecord(
                    tree.text(PythonSyntaxTree.field(node, "name")),
                    path,
                    PythonSyntaxTree.startLine(node),
                    PythonSyntaxTree.lastCodeLine(node),
                    tree.positionalParameters(node),
                    decorators(node),
                    docstring(node));
        }

        private ClassRecord type(final TSNode node) {
            final List<MethodRecord> methods = new ArrayList<>();
            for (final TSNode method : methodsBreadthFirst(node)) {
                methods.add(MethodRecord.of(function(method)));
            }
            return new ClassRecord(
                    tree.text(PythonSyntaxTree.field(node, "name")),
                    path,
                    PythonSyntaxTree.startLine(node),
                    PythonSyntaxTree.lastCodeLine(node),
                    docstring(node),
                    methods);
        }

        private List<String> decorators(final TSNode definition) {
            final List<String> names = new ArrayList<>();
            final TSNode parent = definition.getParent();
            if (!PythonSyntaxTree.is(parent, DECORATED)) {
                return names;
            }
            for (final TSNode child : PythonSyntaxTree.namedChildren(parent)) {
                if (PythonSyntaxTree.is(child, "decorator")) {
                    final List<TSNode> expression =
                            PythonSyntaxTree.namedChildren(child);
                    names.add(expression.isEmpty()
                            ? "" : decoratorName(expression.get(0)));
                }
            }
            return names;
        }

        private String decoratorName(final TSNode node) {
            final TSNode expression = PythonSyntaxTree.unwrap(node);
            if (PythonSyntaxTree.is(expression, "identifier")) {
                return tree.text(expression);
            }
            if (PythonSyntaxTree.is(expression, "attribute")) {
                return tree.text(PythonSyntaxTree.field(expression,
                        "attribute"));
            }
            if (PythonSyntaxTree.is(expression, "call")) {
                return decoratorName(PythonSyntaxTree.field(expression,
                        "function"));
            }
            return "";
        }

        private String docstring(final TSNode definition) {
            final List<TSNode> body = PythonSyntaxTree.namedChildren(
                    PythonSyntaxTree.field(definition, "body"));
            if (body.isEmpty()
                    || !PythonSyntaxTree.is(body.get(0), "expression_statement")) {
                return "";
            }
            final List<TSNode> expression =
                    PythonSyntaxTree.namedChildren(body.get(0));
            if (expression.size() != 1) {
                return "";
            }
            return PythonLiterals.plainString(tree, expression.get(0))
                    .map(PythonLiterals::cleandoc)
                    .orElse("");
        }

        /**
         * Builds the dotted name of a callee. Attribute chains rooted in
         * something other than a name keep only the attribute part.
         */
        private String callName(final TSNode callee) {
            final List<String> parts = new ArrayList<>();
            TSNode current = PythonSyntaxTree.unwrap(callee);
            if (!PythonSyntaxTree.is(current, "identifier")
                    && !PythonSyntaxTree.is(current, "attribute")) {
                return "";
            }
            while (PythonSyntaxTree.is(current, "attribute")) {
                parts.add(tree.text(PythonSyntaxTree.field(current,
                        "attribute")));
                current = PythonSyntaxTree.unwrap(
                        PythonSyntaxTree.field(current, "object"));
            }
            if (PythonSyntaxTree.is(current, "identifier")) {
                parts.add(tree.text(current));
            }
            Collections.reverse(parts);
            return String.join(".", parts);
        }

        /**
         * Lists the functions under a class in breadth-first order of
         * statement nesting.
         *
         * <p>Depth follows Python's statement tree rather than
         * tree-sitter's: blocks, decorators and {@code else} or
         * {@code finally} clauses add no level, each {@code elif} nests
         * one level under the previous branch, and handlers and match
         * cases are a level of their own.</p>
         */
        private List<TSNode> methodsBreadthFirst(final TSNode type) {
            final List<Nested> found = new ArrayList<>();
            collect(type, 0, found);
            found.sort(Comparator.comparingInt(Nested::depth));
            final List<TSNode> methods = new ArrayList<>();
            for (final Nested nested : found) {
                methods.add(nested.node());
            }
            return methods;
        }

        private void collect(final TSNode node, final int depth,
                final List<Nested> found) {
            if (PythonSyntaxTree.is(node, DECORATED)) {
                collect(PythonSyntaxTree.field(node, "definition"), depth,
                        found);
                return;
            }
            if (depth > 0 && PythonSyntaxTree.is(node, FUNCTION)) {
                found.add(new Nested(node, depth));
            }
            int elifs = 0;
            for (final TSNode child : PythonSyntaxTree.namedChildren(node)) {
                switch (child.getType()) {
                    case BLOCK:
                        for (final TSNode statement
                                : PythonSyntaxTree.namedChildren(child)) {
                            collect(statement, depth + 1, found);
                        }
                        break;
                    case "elif_clause":
                        elifs++;
                        collect(child, depth + elifs, found);
                        break;
                    case "else_clause":
                    case "finally_clause":
                        collect(child, depth + elifs, found);
                        break;
                    case "except_clause":
                    case "except_group_clause":
                        collect(child, depth + 1, found);
                        break;
                    default:
                        break;
                }
            }
        }

        /** A function found under a class with its nesting depth. */
        private record Nested(TSNode node, int depth) {
        }
    }

}

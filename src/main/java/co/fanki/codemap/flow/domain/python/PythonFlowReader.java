package co.fanki.codemap.flow.domain.python;

import co.fanki.codemap.analysis.domain.SourceFile;
import co.fanki.codemap.analysis.domain.SourceSyntaxException;
import co.fanki.codemap.analysis.domain.python.PythonLiterals;
import co.fanki.codemap.analysis.domain.python.PythonSyntaxTree;
import co.fanki.codemap.flow.domain.FlowReader;
import co.fanki.codemap.flow.domain.FlowStatement;
import co.fanki.codemap.flow.domain.Operand;
import co.fanki.codemap.shared.Preconditions;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads Python statements into flow statements.
 *
 * <p>Async functions, loops and context managers read like their plain
 * forms. Decorated definitions read as the definition itself, and an
 * {@code elif} reads as an {@code if} nested in the alternative of the
 * previous branch.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonFlowReader implements FlowReader {

    private static final String UNKNOWN = "?";

    private static final String ELIDED = "...";

    @Override
    public List<FlowStatement> read(final SourceFile source) {
        Preconditions.requireNonNull(source, "Source is required");

        final PythonSyntaxTree tree = PythonSyntaxTree.parse(source);
        if (tree.hasSyntaxError()) {
            throw new SourceSyntaxException(tree.syntaxErrorMessage(),
                    tree.syntaxErrorLine());
        }
        return new Reading(tree).statements(tree.root());
    }

    /** Reads the statements of one parsed file. */
    private static final class Reading {

        private final PythonSyntaxTree tree;

        Reading(final PythonSyntaxTree theTree) {
            tree = theTree;
        }

        List<FlowStatement> statements(final TSNode container) {
            final List<FlowStatement> statements = new ArrayList<>();
            for (final TSNode node : PythonSyntaxTree.namedChildren(container)) {
                statements.add(statement(node));
            }
            return statements;
        }

        private List<FlowStatement> body(final TSNode node,
                final String field) {
            return statements(PythonSyntaxTree.field(node, field));
        }

        private FlowStatement statement(final TSNode node) {
            final int line = PythonSyntaxTree.startLine(node);
            switch (node.getType()) {
                case "import_statement":
                    return new FlowStatement.Import(line, null,
                            importedNames(node, null));
                case "import_from_statement":
                    final TSNode module = PythonSyntaxTree.field(node,
                            "module_name");
                    return new FlowStatement.Import(line, moduleName(module),
                            importedNames(node, module));
                case "future_import_statement":
                    return new FlowStatement.Import(line, "__future__",
                            importedNames(node, null));
                case "decorated_definition":
                    return statement(PythonSyntaxTree.field(node,
                            "definition"));
                case "function_definition":
                    return new FlowStatement.Define(line,
                            tree.text(PythonSyntaxTree.field(node, "name")),
                            tree.positionalParameters(node),
                            body(node, "body"));
                case "class_definition":
                    return new FlowStatement.ClassDef(line,
                            tree.text(PythonSyntaxTree.field(node, "name")),
                            bases(PythonSyntaxTree.field(node, "superclasses")),
                            body(node, "body"));
                case "expression_statement":
                    return expressionStatement(node, line);
                case "return_statement":
                    final List<TSNode> value =
                            PythonSyntaxTree.namedChildren(node);
                    return new FlowStatement.Return(line,
                            value.isEmpty() ? null : operand(value.get(0)));
                case "if_statement":
                    return conditional(node, alternatives(node), 0);
                case "for_statement":
                    return new FlowStatement.For(line,
                            nameOr(PythonSyntaxTree.field(node, "left"),
                                    UNKNOWN),
                            nameOr(PythonSyntaxTree.field(node, "right"),
                                    ELIDED),
                            body(node, "body"));
                case "while_statement":
                    return new FlowStatement.While(line, body(node, "body"));
                case "try_statement":
                    return tryStatement(node, line);
                case "with_statement":
                    return new FlowStatement.With(line, body(node, "body"));
                default:
                    return new FlowStatement.Skipped(line);
            }
        }

        private FlowStatement expressionStatement(final TSNode node,
                final int line) {
            final List<TSNode> children = PythonSyntaxTree.namedChildren(node);
            if (children.size() != 1) {
                return new FlowStatement.Skipped(line);
            }
            final TSNode expression = PythonSyntaxTree.unwrap(children.get(0));
            if (PythonSyntaxTree.is(expression, "call")) {
                return new FlowStatement.Call(line, calleeName(expression));
            }
            if (PythonSyntaxTree.is(expression, "assignment")
                    && PythonSyntaxTree.field(expression, "type") == null) {
                return assignment(expression, line);
            }
            return new FlowStatement.Skipped(line);
        }

        /** Chained assignments nest through the right-hand side. */
        private FlowStatement assignment(final TSNode node, final int line) {
            final List<String> targets = new ArrayList<>();
            TSNode current = node;
            while (PythonSyntaxTree.is(current, "assignment")) {
                targets.add(nameOr(PythonSyntaxTree.field(current, "left"),
                        ELIDED));
                current = PythonSyntaxTree.field(current, "right");
            }
            return new FlowStatement.Assign(line, targets, operand(current));
        }

        private FlowStatement.If conditional(final TSNode branch,
                final List<TSNode> alternatives, final int next) {
            return new FlowStatement.If(PythonSyntaxTree.startLine(branch),
                    test(PythonSyntaxTree.field(branch, "condition")),
                    body(branch, "consequence"),
                    alternative(alternatives, next));
        }

        private FlowStatement.Else alternative(final List<TSNode> alternatives,
                final int index) {
            if (index >= alternatives.size()) {
                return null;
            }
            final TSNode clause = alternatives.get(index);
            if (PythonSyntaxTree.is(clause, "elif_clause")) {
                return new FlowStatement.Else(
                        PythonSyntaxTree.startLine(clause),
                        List.of(conditional(clause, alternatives, index + 1)));
            }
            final List<FlowStatement> body = body(clause, "body");
            return new FlowStatement.Else(body.isEmpty()
                    ? PythonSyntaxTree.startLine(clause)
                    : body.get(0).line(), body);
        }

        private List<TSNode> alternatives(final TSNode node) {
            final List<TSNode> clauses = new ArrayList<>();
            for (final TSNode child : PythonSyntaxTree.namedChildren(node)) {
                if (PythonSyntaxTree.is(child, "elif_clause")
                        || PythonSyntaxTree.is(child, "else_clause")) {
                    clauses.add(child);
                }
            }
            return clauses;
        }

        private FlowStatement tryStatement(final TSNode node, final int line) {
            final List<FlowStatement.Handler> handlers = new ArrayList<>();
            for (final TSNode child : PythonSyntaxTree.namedChildren(node)) {
                if (PythonSyntaxTree.is(child, "except_clause")
                        || PythonSyntaxTree.is(child, "except_group_clause")) {
                    handlers.add(new FlowStatement.Handler(
                            PythonSyntaxTree.startLine(child),
                            exceptionType(child),
                            statements(PythonSyntaxTree.firstChildOfType(
                                    child, "block"))));
                }
            }
            return new FlowStatement.Try(line, body(node, "body"), handlers);
        }

        private String exceptionType(final TSNode handler) {
            final List<TSNode> children =
                    PythonSyntaxTree.namedChildren(handler);
            if (children.isEmpty()
                    || PythonSyntaxTree.is(children.get(0), "block")) {
                return "Exception";
            }
            TSNode type = children.get(0);
            if (PythonSyntaxTree.is(type, "as_pattern")) {
                type = PythonSyntaxTree.namedChildren(type).get(0);
            }
            return nameOr(type, "Exception");
        }

        /**
         * Renders a branch test: a comparison by its left operand, a call
         * by its callee, a name by itself.
         */
        private String test(final TSNode condition) {
            final TSNode expression = PythonSyntaxTree.unwrap(condition);
            if (PythonSyntaxTree.is(expression, "comparison_operator")) {
                final List<TSNode> operands =
                        PythonSyntaxTree.namedChildren(expression);
                return nameOr(operands.isEmpty() ? null : operands.get(0),
                        UNKNOWN) + " ...";
            }
            if (PythonSyntaxTree.is(expression, "call")) {
                return nameOr(PythonSyntaxTree.field(expression, "function"),
                        UNKNOWN) + "(...)";
            }
            if (PythonSyntaxTree.is(expression, "identifier")) {
                return tree.text(expression);
            }
            return "condition";
        }

        private Operand operand(final TSNode node) {
            final TSNode expression = PythonSyntaxTree.unwrap(node);
            if (PythonSyntaxTree.is(expression, "call")) {
                return Operand.call(calleeName(expression));
            }
            final Optional<String> literal = PythonLiterals.repr(tree,
                    expression);
            return literal.map(Operand::literal).orElseGet(Operand::other);
        }

        /** A name callee by its name, an attribute callee by the attribute. */
        private String calleeName(final TSNode call) {
            final TSNode callee = PythonSyntaxTree.unwrap(
                    PythonSyntaxTree.field(call, "function"));
            if (PythonSyntaxTree.is(callee, "attribute")) {
                return tree.text(PythonSyntaxTree.field(callee, "attribute"));
            }
            return nameOr(callee, UNKNOWN);
        }

        private List<String> bases(final TSNode superclasses) {
            final List<String> bases = new ArrayList<>();
            for (final TSNode base
                    : PythonSyntaxTree.namedChildren(superclasses)) {
                if (!PythonSyntaxTree.is(base, "keyword_argument")
                        && !PythonSyntaxTree.is(base, "dictionary_splat")) {
                    bases.add(nameOr(base, UNKNOWN));
                }
            }
            return bases;
        }

        private String moduleName(final TSNode module) {
            if (PythonSyntaxTree.is(module, "relative_import")) {
                final TSNode name = PythonSyntaxTree.firstChildOfType(module,
                        "dotted_name");
                return name == null ? UNKNOWN : tree.dottedName(name);
            }
            return module == null ? UNKNOWN : tree.dottedName(module);
        }

        /**
         * Lists imported names, skipping the module an import is from.
         * Aliased imports list the imported name, not the alias.
         */
        private List<String> importedNames(final TSNode node,
                final TSNode from) {
            final List<String> names = new ArrayList<>();
            for (final TSNode child : PythonSyntaxTree.namedChildren(node)) {
                if (from != null
                        && child.getStartByte() == from.getStartByte()) {
                    continue;
                }
                if (PythonSyntaxTree.is(child, "aliased_import")) {
                    names.add(tree.dottedName(PythonSyntaxTree.field(child,
                            "name")));
                } else if (PythonSyntaxTree.is(child, "wildcard_import")) {
                    names.add("*");
                } else {
                    names.add(tree.dottedName(child));
                }
            }
            return names;
        }

        private String nameOr(final TSNode node, final String fallback) {
            final TSNode expression = PythonSyntaxTree.unwrap(node);
            return PythonSyntaxTree.is(expression, "identifier")
                    ? tree.text(expression) : fallback;
        }
    }

}

package co.fanki.codemap.flow.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns the statements of a file into numbered, parent-linked flow steps.
 *
 * <p>Steps are numbered in pre-order: a statement's step, then the steps
 * of everything under it, then its next sibling. The walk uses an
 * explicit worklist, so deeply nested code cannot exhaust the stack.
 * Every body under a statement is cut to the {@link BranchingCaps} for
 * that construct.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowWalker {

    static final String START_COLOR = "#58a6ff";
    static final String IMPORT_COLOR = "#39d2c0";
    static final String DEFINE_COLOR = "#bc8cff";
    static final String BRANCH_COLOR = "#d29922";
    static final String ASSIGN_COLOR = "#8b949e";
    static final String CALL_COLOR = "#3fb950";
    static final String EXIT_COLOR = "#f85149";
    static final String LOOP_COLOR = "#f778ba";
    static final String CONTEXT_COLOR = "#39d2c0";

    private static final int ASSIGN_TARGETS = 2;

    private static final int ASSIGN_PREVIEW = 25;

    private static final int RETURN_PREVIEW = 20;

    private final BranchingCaps caps;

    /**
     * Creates a walker.
     *
     * @param theCaps the branching caps to apply
     */
    public FlowWalker(final BranchingCaps theCaps) {
        caps = Preconditions.requireNonNull(theCaps, "Caps are required");
    }

    /**
     * Walks the top-level statements of a file.
     *
     * @param displayName the file name shown on the start step
     * @param statements the module-level statements
     * @return the steps in id order, the start step first
     */
    public List<FlowStep> walk(final String displayName,
            final List<FlowStatement> statements) {
        Preconditions.requireNonBlank(displayName, "Display name is required");
        Preconditions.requireNonNull(statements, "Statements are required");

        final Walk walk = new Walk();
        final int start = walk.emit(FlowKind.START, displayName,
                "Module entry", 1, START_COLOR);

        final Deque<Pending> worklist = new ArrayDeque<>();
        pushAll(worklist, under(start, statements, statements.size()));
        while (!worklist.isEmpty()) {
            final Pending next = worklist.pop();
            walk.parent = next.parent();
            pushAll(worklist, next.statement().accept(walk));
        }
        return walk.steps;
    }

    private static void pushAll(final Deque<Pending> worklist,
            final List<Pending> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            worklist.push(children.get(i));
        }
    }

    private static List<Pending> under(final int parent,
            final List<? extends FlowStatement> statements, final int cap) {
        final List<Pending> pending = new ArrayList<>();
        for (final FlowStatement statement
                : statements.subList(0, Math.min(cap, statements.size()))) {
            pending.add(new Pending(statement, parent));
        }
        return pending;
    }

    private static <T> List<T> first(final List<T> values, final int cap) {
        return values.subList(0, Math.min(cap, values.size()));
    }

    /** Cuts text to a number of code points. */
    static String preview(final String text, final int length) {
        if (text.codePointCount(0, text.length()) <= length) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, length));
    }

    /** A statement waiting for its step, with the step it hangs from. */
    private record Pending(FlowStatement statement, int parent) {
    }

    /**
     * Emits the step of one statement and returns what goes under it.
     */
    private final class Walk implements FlowStatement.Visitor<List<Pending>> {

        private final List<FlowStep> steps = new ArrayList<>();

        private int parent;

        int emit(final FlowKind kind, final String label, final String detail,
                final int line, final String color) {
            final int id = steps.size() + 1;
            steps.add(new FlowStep(id, kind, label, detail, line,
                    parent == 0 ? null : parent, color));
            return id;
        }

        @Override
        public List<Pending> visitImport(final FlowStatement.Import statement) {
            final String names = String.join(", ",
                    first(statement.names(), caps.importNames()));
            final String label = statement.isFromImport()
                    ? "from " + statement.source() + " import " + names
                    : "import " + names;
            emit(FlowKind.IMPORT, label, "", statement.line(), IMPORT_COLOR);
            return List.of();
        }

        @Override
        public List<Pending> visitDefine(final FlowStatement.Define statement) {
            final int id = emit(FlowKind.DEFINE, "def " + statement.name()
                    + "(" + String.join(", ", first(statement.parameters(),
                            caps.functionParameters())) + ")",
                    statement.body().size() + " stmts", statement.line(),
                    DEFINE_COLOR);
            return under(id, statement.body(), caps.functionBody());
        }

        @Override
        public List<Pending> visitClassDef(
                final FlowStatement.ClassDef statement) {
            final String bases = String.join(", ",
                    first(statement.bases(), caps.classBases()));
            final int id = emit(FlowKind.CLASS, "class " + statement.name()
                    + (bases.isEmpty() ? "" : "(" + bases + ")"),
                    statement.body().size() + " members", statement.line(),
                    BRANCH_COLOR);
            return under(id, statement.body(), caps.classBody());
        }

        @Override
        public List<Pending> visitAssign(final FlowStatement.Assign statement) {
            final Operand value = statement.value();
            final String shown;
            switch (value.form()) {
                case LITERAL:
                    shown = preview(value.text(), ASSIGN_PREVIEW);
                    break;
                case CALL:
                    shown = value.text() + "(...)";
                    break;
                default:
                    shown = "...";
                    break;
            }
            final String targets = String.join(", ",
                    first(statement.targets(), ASSIGN_TARGETS));
            emit(FlowKind.ASSIGN, targets + " = " + shown, "",
                    statement.line(), ASSIGN_COLOR);
            return List.of();
        }

        @Override
        public List<Pending> visitCall(final FlowStatement.Call statement) {
            emit(FlowKind.CALL, statement.name() + "(...)", "function call",
                    statement.line(), CALL_COLOR);
            return List.of();
        }

        @Override
        public List<Pending> visitReturn(final FlowStatement.Return statement) {
            String label = "return";
            if (statement.hasValue()) {
                final Operand value = statement.value();
                label = value.form() == Operand.Form.LITERAL
                        ? label + " " + preview(value.text(), RETURN_PREVIEW)
                        : label + " ...";
            }
            emit(FlowKind.RETURN, label, "", statement.line(), EXIT_COLOR);
            return List.of();
        }

        @Override
        public List<Pending> visitIf(final FlowStatement.If statement) {
            final int id = emit(FlowKind.CONDITION, "if " + statement.test(),
                    "", statement.line(), BRANCH_COLOR);
            final List<Pending> children = under(id, statement.body(),
                    caps.block());
            if (statement.alternative() != null) {
                children.add(new Pending(statement.alternative(), id));
            }
            return children;
        }

        @Override
        public List<Pending> visitElse(final FlowStatement.Else statement) {
            final int id = emit(FlowKind.CONDITION, "else", "",
                    statement.line(), BRANCH_COLOR);
            return under(id, statement.body(), caps.block());
        }

        @Override
        public List<Pending> visitFor(final FlowStatement.For statement) {
            final int id = emit(FlowKind.LOOP, "for " + statement.target()
                    + " in " + statement.iterable(), "", statement.line(),
                    LOOP_COLOR);
            return under(id, statement.body(), caps.block());
        }

        @Override
        public List<Pending> visitWhile(final FlowStatement.While statement) {
            final int id = emit(FlowKind.LOOP, "while loop", "",
                    statement.line(), LOOP_COLOR);
            return under(id, statement.body(), caps.block());
        }

        @Override
        public List<Pending> visitTry(final FlowStatement.Try statement) {
            final int id = emit(FlowKind.CONDITION, "try", "",
                    statement.line(), BRANCH_COLOR);
            final List<Pending> children = under(id, statement.body(),
                    caps.block());
            children.addAll(under(id, statement.handlers(), caps.handlers()));
            return children;
        }

        @Override
        public List<Pending> visitHandler(
                final FlowStatement.Handler statement) {
            final int id = emit(FlowKind.CONDITION, "except "
                    + statement.exceptionType(), "", statement.line(),
                    EXIT_COLOR);
            return under(id, statement.body(), caps.handlerBody());
        }

        @Override
        public List<Pending> visitWith(final FlowStatement.With statement) {
            final int id = emit(FlowKind.CALL, "with ...", "context manager",
                    statement.line(), CONTEXT_COLOR);
            return under(id, statement.body(), caps.block());
        }

        @Override
        public List<Pending> visitSkipped(
                final FlowStatement.Skipped statement) {
            return List.of();
        }
    }

}

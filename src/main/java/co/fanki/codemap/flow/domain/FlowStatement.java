package co.fanki.codemap.flow.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.List;

/**
 * A statement of interest to the flow diagram, reduced to what the
 * diagram shows of it.
 *
 * <p>Statements the diagram ignores are kept as {@link Skipped} so they
 * still take their place in a capped body and in the statement counts.
 * {@link Else} and {@link Handler} are not statements of their own but
 * branches that become steps under their owning statement.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public sealed interface FlowStatement permits FlowStatement.Import,
        FlowStatement.Define, FlowStatement.ClassDef, FlowStatement.Assign,
        FlowStatement.Call, FlowStatement.Return, FlowStatement.If,
        FlowStatement.Else, FlowStatement.For, FlowStatement.While,
        FlowStatement.Try, FlowStatement.Handler, FlowStatement.With,
        FlowStatement.Skipped {

    /**
     * Returns the 1-based line the statement starts on.
     *
     * @return the line
     */
    int line();

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive matcher over the statement variants.
     *
     * @param <R> the result type
     */
    interface Visitor<R> {

        R visitImport(Import statement);

        R visitDefine(Define statement);

        R visitClassDef(ClassDef statement);

        R visitAssign(Assign statement);

        R visitCall(Call statement);

        R visitReturn(Return statement);

        R visitIf(If statement);

        R visitElse(Else statement);

        R visitFor(For statement);

        R visitWhile(While statement);

        R visitTry(Try statement);

        R visitHandler(Handler statement);

        R visitWith(With statement);

        R visitSkipped(Skipped statement);
    }

    /**
     * An import. A plain {@code import a, b} has no source module.
     *
     * @param line the line
     * @param source the module imported from, null for a plain import
     * @param names the imported names
     */
    record Import(int line, String source, List<String> names)
            implements FlowStatement {

        public Import {
            names = List.copyOf(names);
        }

        public boolean isFromImport() {
            return source != null;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * A function definition.
     *
     * @param line the line of the definition keyword
     * @param name the function name
     * @param parameters the ordinary positional parameter names
     * @param body the body statements
     */
    record Define(int line, String name, List<String> parameters,
            List<FlowStatement> body) implements FlowStatement {

        public Define {
            Preconditions.requireNonBlank(name, "Function name is required");
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitDefine(this);
        }
    }

    /**
     * A class definition.
     *
     * @param line the line of the class keyword
     * @param name the class name
     * @param bases the base class names, {@code ?} for non-name bases
     * @param body the body statements
     */
    record ClassDef(int line, String name, List<String> bases,
            List<FlowStatement> body) implements FlowStatement {

        public ClassDef {
            Preconditions.requireNonBlank(name, "Class name is required");
            bases = List.copyOf(bases);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    /**
     * A plain assignment, chained targets included.
     *
     * @param line the line
     * @param targets the target names, {@code ...} for non-name targets
     * @param value the assigned value
     */
    record Assign(int line, List<String> targets, Operand value)
            implements FlowStatement {

        public Assign {
            targets = List.copyOf(targets);
            Preconditions.requireNonNull(value, "Value is required");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * A call used as a statement.
     *
     * @param line the line
     * @param name the called name, {@code ?} when not a name
     */
    record Call(int line, String name) implements FlowStatement {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * A return statement.
     *
     * @param line the line
     * @param value the returned value, null for a bare return
     */
    record Return(int line, Operand value) implements FlowStatement {

        public boolean hasValue() {
            return value != null;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * A conditional. An {@code elif} is an {@code If} inside the
     * alternative of the previous branch.
     *
     * @param line the line
     * @param test the rendered test
     * @param body the statements of the true branch
     * @param alternative the alternative branch, null if none
     */
    record If(int line, String test, List<FlowStatement> body,
            Else alternative) implements FlowStatement {

        public If {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * The alternative branch of a conditional.
     *
     * @param line the line of its first statement
     * @param body the branch statements
     */
    record Else(int line, List<FlowStatement> body)
            implements FlowStatement {

        public Else {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitElse(this);
        }
    }

    /**
     * A for loop.
     *
     * @param line the line
     * @param target the loop variable, {@code ?} when not a name
     * @param iterable the iterated name, {@code ...} when not a name
     * @param body the loop body
     */
    record For(int line, String target, String iterable,
            List<FlowStatement> body) implements FlowStatement {

        public For {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    /**
     * A while loop.
     *
     * @param line the line
     * @param body the loop body
     */
    record While(int line, List<FlowStatement> body)
            implements FlowStatement {

        public While {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * A try statement with its exception handlers.
     *
     * @param line the line
     * @param body the guarded statements
     * @param handlers the handlers, in order
     */
    record Try(int line, List<FlowStatement> body, List<Handler> handlers)
            implements FlowStatement {

        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /**
     * An exception handler.
     *
     * @param line the line
     * @param exceptionType the caught type name, {@code Exception} when
     *        not a plain name or absent
     * @param body the handler statements
     */
    record Handler(int line, String exceptionType, List<FlowStatement> body)
            implements FlowStatement {

        public Handler {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitHandler(this);
        }
    }

    /**
     * A context manager block.
     *
     * @param line the line
     * @param body the block statements
     */
    record With(int line, List<FlowStatement> body) implements FlowStatement {

        public With {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    /**
     * A statement the diagram does not show.
     *
     * @param line the line
     */
    record Skipped(int line) implements FlowStatement {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitSkipped(this);
        }
    }

}

package co.fanki.codemap.flow.domain;

/**
 * The right-hand side of an assignment or a returned value, as much of it
 * as a diagram label shows.
 *
 * @param form what kind of expression it is
 * @param text the literal repr or the called name, empty otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Operand(Form form, String text) {

    /** Expression shapes a label distinguishes. */
    public enum Form {
        LITERAL,
        CALL,
        OTHER
    }

    private static final Operand OTHER = new Operand(Form.OTHER, "");

    public static Operand literal(final String repr) {
        return new Operand(Form.LITERAL, repr);
    }

    public static Operand call(final String name) {
        return new Operand(Form.CALL, name);
    }

    public static Operand other() {
        return OTHER;
    }

}

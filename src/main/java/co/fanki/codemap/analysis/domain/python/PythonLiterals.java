package co.fanki.codemap.analysis.domain.python;

import org.treesitter.TSNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates Python literal expressions without running Python.
 *
 * <p>Covers the constant forms the compiler folds: numbers, strings,
 * bytes, implicitly concatenated strings, {@code True}, {@code False},
 * {@code None} and {@code ...}. Values are rendered the way Python's
 * {@code repr} shows them. F-strings are never constants.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonLiterals {

    private static final int TAB_SIZE = 8;

    private PythonLiterals() {
    }

    /**
     * Renders a constant expression with Python repr semantics.
     *
     * @param tree the syntax tree owning the node
     * @param node the expression
     * @return the repr, empty if the expression is not a constant
     */
    public static Optional<String> repr(final PythonSyntaxTree tree,
            final TSNode node) {
        final TSNode expression = PythonSyntaxTree.unwrap(node);
        if (expression == null || expression.isNull()) {
            return Optional.empty();
        }
        final String text = tree.text(expression);
        switch (expression.getType()) {
            case "integer":
                return Optional.of(reprInteger(text));
            case "float":
                return Optional.of(reprFloat(text));
            case "true":
                return Optional.of("True");
            case "false":
                return Optional.of("False");
            case "none":
                return Optional.of("None");
            case "ellipsis":
                return Optional.of("Ellipsis");
            case "string":
            case "concatenated_string":
                return stringValue(tree, expression).map(PythonLiterals::repr);
            default:
                return Optional.empty();
        }
    }

    /**
     * Evaluates a plain string literal, as used for docstrings.
     *
     * <p>Bytes literals and f-strings are not plain strings.</p>
     *
     * @param tree the syntax tree owning the node
     * @param node the expression
     * @return the decoded text, empty if not a plain string literal
     */
    public static Optional<String> plainString(final PythonSyntaxTree tree,
            final TSNode node) {
        final TSNode expression = PythonSyntaxTree.unwrap(node);
        if (!PythonSyntaxTree.is(expression, "string")
                && !PythonSyntaxTree.is(expression, "concatenated_string")) {
            return Optional.empty();
        }
        return stringValue(tree, expression)
                .filter(value -> !value.bytes())
                .map(StringValue::text);
    }

    private static Optional<StringValue> stringValue(
            final PythonSyntaxTree tree, final TSNode node) {
        final List<TSNode> parts = new ArrayList<>();
        if (PythonSyntaxTree.is(node, "concatenated_string")) {
            parts.addAll(PythonSyntaxTree.namedChildren(node));
        } else {
            parts.add(node);
        }
        final StringBuilder text = new StringBuilder();
        boolean bytes = false;
        for (final TSNode part : parts) {
            if (!PythonSyntaxTree.is(part, "string")) {
                return Optional.empty();
            }
            final StringValue value = decode(tree.text(part));
            if (value == null) {
                return Optional.empty();
            }
            bytes |= value.bytes();
            text.append(value.text());
        }
        return Optional.of(new StringValue(text.toString(), bytes));
    }

    /**
     * Decodes the source text of a single string literal.
     *
     * @param literal the literal, prefix and quotes included
     * @return the value, null for f-strings and malformed literals
     */
    static StringValue decode(final String literal) {
        int start = 0;
        while (start < literal.length()
                && Character.isLetter(literal.charAt(start))) {
            start++;
        }
        final String prefix = literal.substring(0, start)
                .toLowerCase(Locale.ROOT);
        if (prefix.contains("f") || prefix.contains("t")) {
            return null;
        }
        final String quoted = literal.substring(start);
        final int quoteLength = quoted.startsWith("\"\"\"")
                || quoted.startsWith("'''") ? 3 : 1;
        if (quoted.length() < quoteLength * 2) {
            return null;
        }
        final String body = quoted.substring(quoteLength,
                quoted.length() - quoteLength);
        final boolean bytes = prefix.contains("b");
        final String text = prefix.contains("r")
                ? body : unescape(body, bytes);
        return new StringValue(text, bytes);
    }

    /**
     * Resolves backslash escapes the way the Python tokenizer does.
     *
     * @param body the literal body between the quotes
     * @param bytes whether the literal is a bytes literal
     * @return the decoded text
     */
    static String unescape(final String body, final boolean bytes) {
        final StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            final char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            final char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n':
                    break;
                case '\r':
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                    break;
                case '\\':
                case '\'':
                case '"':
                    out.append(next);
                    break;
                case 'a':
                    out.append('\u0007');
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'v':
                    out.append('\u000b');
                    break;
                case 'x':
                    i = appendHex(body, i, 2, "\\x", out);
                    break;
                case 'u':
                    i = bytes ? appendRaw("\\u", i, out)
                            : appendHex(body, i, 4, "\\u", out);
                    break;
                case 'U':
                    i = bytes ? appendRaw("\\U", i, out)
                            : appendHex(body, i, 8, "\\U", out);
                    break;
                case 'N':
                    i = bytes ? appendRaw("\\N", i, out)
                            : appendNamed(body, i, out);
                    break;
                default:
                    if (next >= '0' && next <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 2
                                && body.charAt(end) >= '0'
                                && body.charAt(end) <= '7') {
                            end++;
                        }
                        final int value = Integer.parseInt(
                                body.substring(i - 1, end), 8);
                        out.appendCodePoint(bytes ? value & 0xff : value);
                        i = end;
                    } else {
                        out.append('\\').append(next);
                    }
                    break;
            }
        }
        return out.toString();
    }

    private static int appendHex(final String body, final int from,
            final int digits, final String escape, final StringBuilder out) {
        final int end = from + digits;
        if (end <= body.length()) {
            try {
                final int value = Integer.parseUnsignedInt(
                        body.substring(from, end), 16);
                if (Character.isValidCodePoint(value)) {
                    out.appendCodePoint(value);
                    return end;
                }
            } catch (NumberFormatException e) {
                // Not hex digits; kept verbatim below.
            }
        }
        return appendRaw(escape, from, out);
    }

    private static int appendNamed(final String body, final int from,
            final StringBuilder out) {
        final int close = body.indexOf('}', from);
        if (from < body.length() && body.charAt(from) == '{' && close > 0) {
            try {
                out.appendCodePoint(Character.codePointOf(
                        body.substring(from + 1, close)));
                return close + 1;
            } catch (IllegalArgumentException e) {
                // Unknown character name; kept verbatim below.
            }
        }
        return appendRaw("\\N", from, out);
    }

    private static int appendRaw(final String escape, final int from,
            final StringBuilder out) {
        out.append(escape);
        return from;
    }

    /**
     * Renders a decoded string or bytes value like Python's repr.
     *
     * @param value the value
     * @return the quoted representation
     */
    static String repr(final StringValue value) {
        final String text = value.text();
        final char quote = text.indexOf('\'') >= 0
                && text.indexOf('"') < 0 ? '"' : '\'';
        final StringBuilder out = new StringBuilder();
        if (value.bytes()) {
            out.append('b');
        }
        out.append(quote);
        text.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                out.append('\\').appendCodePoint(cp);
            } else if (cp == '\n') {
                out.append("\\n");
            } else if (cp == '\r') {
                out.append("\\r");
            } else if (cp == '\t') {
                out.append("\\t");
            } else if (cp < 0x20 || cp == 0x7f
                    || (value.bytes() && cp > 0x7f)) {
                out.append(String.format("\\x%02x", cp & 0xff));
            } else if (cp > 0x7f && !isPrintable(cp)) {
                out.append(escapeCodePoint(cp));
            } else {
                out.appendCodePoint(cp);
            }
        });
        out.append(quote);
        return out.toString();
    }

    /** Mirrors {@code str.isprintable} for a non-ASCII code point. */
    private static boolean isPrintable(final int cp) {
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    private static String escapeCodePoint(final int cp) {
        if (cp < 0x100) {
            return String.format("\\x%02x", cp);
        }
        if (cp < 0x10000) {
            return String.format("\\u%04x", cp);
        }
        return String.format("\\U%08x", cp);
    }

    /**
     * Renders an integer literal as Python prints its value.
     *
     * @param literal the literal text, e.g. {@code 0x_ff}
     * @return the decimal value, e.g. {@code 255}
     */
    static String reprInteger(final String literal) {
        final String digits = literal.replace("_", "")
                .toLowerCase(Locale.ROOT);
        if (digits.endsWith("j")) {
            return reprImaginary(digits);
        }
        try {
            if (digits.startsWith("0x")) {
                return new BigInteger(digits.substring(2), 16).toString();
            }
            if (digits.startsWith("0o")) {
                return new BigInteger(digits.substring(2), 8).toString();
            }
            if (digits.startsWith("0b")) {
                return new BigInteger(digits.substring(2), 2).toString();
            }
            return new BigInteger(digits.endsWith("l")
                    ? digits.substring(0, digits.length() - 1)
                    : digits).toString();
        } catch (NumberFormatException e) {
            return digits;
        }
    }

    /**
     * Renders a float literal as Python's float repr.
     *
     * <p>Python switches to exponent notation below 1e-4 and from 1e16
     * on.</p>
     *
     * @param literal the literal text, e.g. {@code 1_000.50}
     * @return the repr, e.g. {@code 1000.5}
     */
    static String reprFloat(final String literal) {
        final String digits = literal.replace("_", "")
                .toLowerCase(Locale.ROOT);
        if (digits.endsWith("j")) {
            return reprImaginary(digits);
        }
        final double value;
        try {
            value = Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return digits;
        }
        if (Double.isInfinite(value)) {
            return "inf";
        }
        final BigDecimal decimal = new BigDecimal(Double.toString(value))
                .stripTrailingZeros();
        final String unscaled = decimal.unscaledValue().abs().toString();
        final int exponent = unscaled.length() - 1 - decimal.scale();
        if (decimal.signum() == 0 || (exponent >= -4 && exponent < 16)) {
            final String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        final StringBuilder out = new StringBuilder();
        out.append(unscaled.charAt(0));
        if (unscaled.length() > 1) {
            out.append('.').append(unscaled, 1, unscaled.length());
        }
        out.append('e').append(exponent < 0 ? '-' : '+');
        final int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            out.append('0');
        }
        return out.append(magnitude).toString();
    }

    /**
     * Renders an imaginary literal as Python's complex repr: the float
     * repr of the magnitude without a trailing {@code .0}.
     *
     * @param literal the lower-case literal without underscores, e.g.
     *        {@code 1e3j}
     * @return the repr, e.g. {@code 1000j}
     */
    static String reprImaginary(final String literal) {
        final String magnitude = reprFloat(literal.substring(0,
                literal.length() - 1));
        return (magnitude.endsWith(".0")
                ? magnitude.substring(0, magnitude.length() - 2)
                : magnitude) + "j";
    }

    /**
     * Cleans up docstring indentation like {@code inspect.cleandoc}.
     *
     * <p>Tabs are expanded, the first line is stripped of leading
     * whitespace, the common indentation of the remaining lines is
     * removed, and blank lines at both ends are dropped.</p>
     *
     * @param doc the raw docstring
     * @return the cleaned docstring
     */
    public static String cleandoc(final String doc) {
        final List<String> lines = new ArrayList<>();
        for (final String line : doc.split("\n", -1)) {
            lines.add(expandTabs(line));
        }
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            final String line = lines.get(i);
            final String content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }
        lines.set(0, lines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                final String line = lines.get(i);
                lines.set(i, line.length() > margin
                        ? line.substring(margin) : line.stripLeading());
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(final String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        final StringBuilder out = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '\t') {
                do {
                    out.append(' ');
                } while (out.length() % TAB_SIZE != 0);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * A decoded string or bytes literal.
     *
     * @param text the decoded characters, one per byte for bytes
     * @param bytes whether the literal is a bytes literal
     */
    record StringValue(String text, boolean bytes) {
    }

}

package co.fanki.codemap.flow.domain;

import java.util.Map;

/**
 * Makes label text safe inside a quoted Mermaid node label.
 *
 * <p>Every character with a meaning in Mermaid shape syntax is replaced
 * by a look-alike glyph. Nothing is removed and the substitutes are not
 * themselves replaced, so escaping safe text is a no-op.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MermaidLabels {

    private static final Map<Character, Character> SUBSTITUTES = Map.ofEntries(
            Map.entry('"', '\''),
            Map.entry('<', '‹'),
            Map.entry('>', '›'),
            Map.entry('&', '+'),
            Map.entry('(', '❨'),
            Map.entry(')', '❩'),
            Map.entry('[', '⟦'),
            Map.entry(']', '⟧'),
            Map.entry('{', '❴'),
            Map.entry('}', '❵'),
            Map.entry('#', '♯'));

    private MermaidLabels() {
    }

    /**
     * Escapes a label.
     *
     * @param text the raw label
     * @return the label with every special character substituted
     */
    public static String escape(final String text) {
        final StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            out.append(SUBSTITUTES.getOrDefault(c, c));
        }
        return out.toString();
    }

}

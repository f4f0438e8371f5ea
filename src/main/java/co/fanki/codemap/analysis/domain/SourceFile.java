package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The text of one source file, identified by its project-relative path.
 *
 * <p>Immutable once read. Keeps a line index so that parse problems can be
 * reported with the offending source line, and the UTF-8 encoding of the
 * text because syntax tree offsets are byte offsets. A leading byte order
 * mark is dropped so those offsets line up with the parser's.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceFile {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final String path;
    private final String text;
    private final byte[] utf8;
    private final int[] lineStarts;

    /**
     * Creates a source file.
     *
     * @param thePath the path relative to the project root, any separator
     * @param theText the decoded file content, with or without a leading
     *        byte order mark
     */
    public SourceFile(final String thePath, final String theText) {
        this.path = Preconditions.requireNonBlank(thePath,
                "Source path is required").replace('\\', '/');
        this.text = stripByteOrderMark(Preconditions.requireNonNull(theText,
                "Source text is required"));
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
        this.lineStarts = indexLines(text);
    }

    public String path() {
        return path;
    }

    public String text() {
        return text;
    }

    /**
     * Returns the last path segment, e.g. {@code main.py}.
     *
     * @return the file name
     */
    public String displayName() {
        final int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Returns the text of a line without its terminator.
     *
     * @param lineNumber the 1-based line number
     * @return the line text, empty when out of range
     */
    public String line(final int lineNumber) {
        if (lineNumber < 1 || lineNumber > lineStarts.length) {
            return "";
        }
        final int start = lineStarts[lineNumber - 1];
        int end = lineNumber < lineStarts.length
                ? lineStarts[lineNumber] : text.length();
        while (end > start && (text.charAt(end - 1) == '\n'
                || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Slices the text between two UTF-8 byte offsets.
     *
     * @param startByte the inclusive start offset
     * @param endByte the exclusive end offset
     * @return the decoded slice, empty when the range is invalid
     */
    public String slice(final int startByte, final int endByte) {
        if (startByte >= 0 && endByte <= utf8.length && startByte < endByte) {
            return new String(utf8, startByte, endByte - startByte,
                    StandardCharsets.UTF_8);
        }
        return "";
    }

    private static String stripByteOrderMark(final String theText) {
        return theText.startsWith(BYTE_ORDER_MARK)
                ? theText.substring(BYTE_ORDER_MARK.length()) : theText;
    }

    private static int[] indexLines(final String content) {
        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            final char c = content.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        if (starts.size() > 1 && starts.get(starts.size() - 1)
                == content.length()) {
            starts.remove(starts.size() - 1);
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

}

package com.mimecast.footer.rewrite;

/**
 * Signature line mode.
 *
 * <p>Two state automaton, switched only by marker lines:
 * <pre>
 * PLAIN --&lt;html&gt;--&gt; HTML
 * HTML --&lt;/html&gt;--&gt; PLAIN
 * </pre>
 * Any other line keeps the current state.
 */
public enum SegmentType {
    PLAIN,
    HTML;

    /**
     * Line opening a literal HTML region.
     */
    public static final String HTML_START = "<html>";

    /**
     * Line closing a literal HTML region.
     */
    public static final String HTML_END = "</html>";

    /**
     * Is the line one of the two markers.
     *
     * @param line Line without EOL.
     * @return Boolean.
     */
    public static boolean isMarker(String line) {
        return HTML_START.equals(line) || HTML_END.equals(line);
    }

    /**
     * Gets state after reading a line.
     *
     * @param line Line without EOL.
     * @return Next state.
     */
    public SegmentType next(String line) {
        if (HTML_START.equals(line)) {
            return HTML;
        }
        if (HTML_END.equals(line)) {
            return PLAIN;
        }
        return this;
    }
}

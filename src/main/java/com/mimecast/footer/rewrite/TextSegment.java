package com.mimecast.footer.rewrite;

/**
 * Run of consecutive signature lines in the same mode.
 */
public final class TextSegment {

    /**
     * Segment mode.
     */
    private final SegmentType type;

    /**
     * Lines, each terminated by a line feed.
     */
    private final String text;

    /**
     * Constructs a new TextSegment instance.
     *
     * @param type Segment mode.
     * @param text Lines, each terminated by a line feed.
     */
    public TextSegment(SegmentType type, String text) {
        this.type = type;
        this.text = text;
    }

    public SegmentType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean isHtml() {
        return type == SegmentType.HTML;
    }

    /**
     * Gets number of lines.
     *
     * @return Line count.
     */
    public int getLineCount() {
        return (int) text.chars().filter(c -> c == '\n').count();
    }

    @Override
    public String toString() {
        return type + "[" + text.replace("\n", "\\n") + "]";
    }
}

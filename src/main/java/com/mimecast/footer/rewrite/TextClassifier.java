package com.mimecast.footer.rewrite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits signature text into plain and literal HTML segments.
 *
 * <p>Starts in {@link SegmentType#PLAIN}. Marker lines switch mode and are dropped.
 * <br>Consecutive lines of one mode are merged into a single segment.
 * <br>A region left open at the end of the signature runs to the end.
 *
 * @see SegmentType
 */
public class TextClassifier {

    /**
     * Classifies signature lines.
     *
     * @param signature Signature text with LF line endings.
     * @return Segments in original order.
     */
    public List<TextSegment> classify(String signature) {
        List<TextSegment> segments = new ArrayList<>();
        SegmentType mode = SegmentType.PLAIN;
        StringBuilder buffer = new StringBuilder();

        for (String line : lines(signature)) {
            if (SegmentType.isMarker(line)) {
                SegmentType next = mode.next(line);
                if (next != mode) {
                    close(segments, mode, buffer);
                    mode = next;
                }
                continue;
            }

            buffer.append(line).append('\n');
        }
        close(segments, mode, buffer);

        return segments;
    }

    /**
     * Checks if any signature line opens a literal HTML region.
     *
     * @param signature Signature text with LF line endings.
     * @return Boolean.
     */
    public static boolean hasHtmlMarker(String signature) {
        return lines(signature).contains(SegmentType.HTML_START);
    }

    /**
     * Splits text in lines without EOL.
     * <p>A final line feed does not produce an empty last line.
     *
     * @param text Text with LF line endings.
     * @return List of lines.
     */
    static List<String> lines(String text) {
        if (text.isEmpty()) {
            return new ArrayList<>();
        }

        String trimmed = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return Arrays.asList(trimmed.split("\n", -1));
    }

    /**
     * Emits the open segment if it holds any lines.
     *
     * @param segments Segments list.
     * @param mode     Current mode.
     * @param buffer   Open segment lines.
     */
    private static void close(List<TextSegment> segments, SegmentType mode, StringBuilder buffer) {
        if (buffer.length() > 0) {
            segments.add(new TextSegment(mode, buffer.toString()));
            buffer.setLength(0);
        }
    }
}

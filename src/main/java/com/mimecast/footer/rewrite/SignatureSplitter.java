package com.mimecast.footer.rewrite;

import org.apache.commons.lang3.tuple.Pair;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates body content from the signature.
 *
 * <p>The signature starts after the first line consisting of exactly dash, dash, space.
 * <br>The delimiter line belongs to neither side.
 */
public class SignatureSplitter {

    /**
     * Signature delimiter line.
     */
    public static final String DELIMITER = "-- ";

    /**
     * Delimiter line with its line feed, if any.
     */
    private static final Pattern DELIMITER_LINE = Pattern.compile("^-- $\\n?", Pattern.MULTILINE | Pattern.UNIX_LINES);

    /**
     * Splits body.
     *
     * @param body Body text with LF line endings.
     * @return Pair of content and signature, signature empty if no delimiter.
     */
    public Pair<String, String> split(String body) {
        Matcher matcher = DELIMITER_LINE.matcher(body);
        if (matcher.find()) {
            return Pair.of(body.substring(0, matcher.start()), body.substring(matcher.end()));
        }

        return Pair.of(body, "");
    }
}

package com.mimecast.footer.mime.headers;

import java.util.ArrayList;
import java.util.List;

/**
 * MIME header container.
 * <p>
 * Keeps the value exactly as received, folding included, so untouched headers are written back
 * byte for byte. Readers get the unfolded value and parameter lookups.
 */
public class MimeHeader {

    /**
     * Header name as received.
     */
    private final String name;

    /**
     * Raw header value, may contain folded line breaks.
     */
    private final String rawValue;

    /**
     * Header text as received or built, without the final line terminator.
     */
    private final String line;

    /**
     * Constructs a new MimeHeader instance from a full header line.
     * <p>
     * Expects {@code Name: value}, optionally folded over several lines.
     * A trailing line terminator is discarded.
     *
     * @param header Header line(s).
     */
    public MimeHeader(String header) {
        this.line = stripTerminator(header);
        int colon = line.indexOf(':');
        if (colon < 0) {
            this.name = line.trim();
            this.rawValue = "";
        } else {
            this.name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1);
            this.rawValue = value.startsWith(" ") ? value.substring(1) : value;
        }
    }

    /**
     * Constructs a new MimeHeader instance with given name and value.
     *
     * @param name  Header name.
     * @param value Header value.
     */
    public MimeHeader(String name, String value) {
        this.name = name;
        this.rawValue = value;
        this.line = name + ": " + value;
    }

    /**
     * Gets header name.
     *
     * @return Header name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets unfolded header value.
     *
     * @return Header value.
     */
    public String getValue() {
        return rawValue.replaceAll("\r?\n[ \t]", " ").trim();
    }

    /**
     * Gets raw header value as received.
     *
     * @return Header value.
     */
    public String getRawValue() {
        return rawValue;
    }

    /**
     * Gets header value without parameters in lower case.
     * <p>For {@code text/plain; charset="utf-8"} this returns {@code text/plain}.
     *
     * @return Clean value.
     */
    public String getCleanValue() {
        String value = getValue();
        int semicolon = value.indexOf(';');
        if (semicolon >= 0) {
            value = value.substring(0, semicolon);
        }
        return value.trim().toLowerCase();
    }

    /**
     * Gets header parameter value by name.
     * <p>Parameter names are matched case-insensitively and surrounding quotes are removed.
     *
     * @param parameter Parameter name.
     * @return Parameter value or null if not found.
     */
    public String getParameter(String parameter) {
        List<String> params = splitParameters(getValue());
        for (int i = 1; i < params.size(); i++) {
            String param = params.get(i);
            int eq = param.indexOf('=');
            if (eq < 0) {
                continue;
            }

            if (param.substring(0, eq).trim().equalsIgnoreCase(parameter)) {
                String value = param.substring(eq + 1).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }

        return null;
    }

    /**
     * Checks if header name matches given name case-insensitively.
     *
     * @param other Header name.
     * @return Boolean.
     */
    public boolean isNamed(String other) {
        return name.equalsIgnoreCase(other);
    }

    /**
     * Renders header with the given line separator.
     * <p>Parsed headers come out exactly as received, spacing around the colon included.
     *
     * @param separator Line separator.
     * @return Header line.
     */
    public String toString(String separator) {
        return line + separator;
    }

    /**
     * Renders header with CRLF line ending.
     *
     * @return Header line.
     */
    @Override
    public String toString() {
        return toString("\r\n");
    }

    /**
     * Splits value on semicolons outside of quoted strings.
     *
     * @param value Header value.
     * @return List of segments, the first being the main value.
     */
    private static List<String> splitParameters(String value) {
        List<String> list = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : value.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
            }

            if (c == ';' && !quoted) {
                list.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        list.add(current.toString());

        return list;
    }

    /**
     * Strips trailing CR and LF characters.
     *
     * @param line Line.
     * @return Line without terminator.
     */
    private static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}

package com.mimecast.footer.mime;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;
import com.mimecast.footer.mime.io.LineInputStream;
import com.mimecast.footer.mime.parts.FileMimePart;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;
import com.mimecast.footer.mime.parts.TextMimePart;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * EmailParser decodes an RFC 2822 message into a tree of MIME parts.
 * <p>
 * This parser handles:
 * <ul>
 *     <li>Leading mbox envelope line, kept on the root part</li>
 *     <li>Multi-line headers, folding preserved for re-encoding</li>
 *     <li>Single part and arbitrarily nested multipart messages</li>
 *     <li>Multipart preamble and epilogue text</li>
 *     <li>CRLF or bare LF line endings</li>
 * </ul>
 * <p>
 * Bodies are kept as transmitted. Untouched parts are written back byte for byte by {@link EmailWriter}.
 * <p>
 * Example usage:
 * <pre>
 * EmailParser parser = new EmailParser(inputStream);
 * MimePart message = parser.parse();
 * String separator = parser.getLineSeparator();
 * </pre>
 *
 * @see EmailWriter
 * @see MimePart
 */
public class EmailParser {
    private static final Logger log = LogManager.getLogger(EmailParser.class);

    /**
     * Email input stream with line-based reading.
     */
    private final LineInputStream stream;

    /**
     * Line separator used by the message, taken from the first line.
     */
    private String lineSeparator = "\r\n";

    /**
     * Constructs a new EmailParser instance from an input stream.
     * <p>The parser takes ownership of the stream and closes it after parsing.
     *
     * @param inputStream InputStream instance.
     */
    public EmailParser(InputStream inputStream) {
        this.stream = new LineInputStream(inputStream);
    }

    /**
     * Constructs a new EmailParser instance from message bytes.
     *
     * @param bytes Message bytes.
     */
    public EmailParser(byte[] bytes) {
        this(new ByteArrayInputStream(bytes));
    }

    /**
     * Gets line separator detected while parsing.
     *
     * @return Line separator, CRLF if the message had no line endings.
     */
    public String getLineSeparator() {
        return lineSeparator;
    }

    /**
     * Parses the complete message.
     *
     * @return Root MimePart.
     * @throws IOException Unable to read.
     */
    public MimePart parse() throws IOException {
        List<byte[]> lines = new ArrayList<>();
        try (stream) {
            byte[] bytes;
            while ((bytes = stream.readLine()) != null) {
                lines.add(bytes);
            }
        }

        if (!lines.isEmpty()) {
            String terminator = terminatorOf(lines.get(0));
            if (!terminator.isEmpty()) {
                lineSeparator = terminator;
            }
        }
        log.debug("Parsing message of {} lines", stream.getLineNumber());

        String unixFrom = null;
        if (!lines.isEmpty() && isUnixFrom(lines.get(0))) {
            unixFrom = StringUtils.stripEnd(new String(lines.get(0), StandardCharsets.ISO_8859_1), "\r\n");
            lines = lines.subList(1, lines.size());
            log.debug("Found mbox envelope line: {}", unixFrom);
        }

        return parseEntity(lines).setUnixFrom(unixFrom);
    }

    /**
     * Checks if a line is an mbox envelope line.
     * <p>Starts with {@code From } and has no header colon right after the name.
     *
     * @param bytes Line bytes.
     * @return Boolean.
     */
    static boolean isUnixFrom(byte[] bytes) {
        String line = new String(bytes, StandardCharsets.ISO_8859_1);
        return line.startsWith("From ") && !line.substring(5).stripLeading().startsWith(":");
    }

    /**
     * Parses an entity made of headers, blank line and body.
     *
     * @param lines Entity lines.
     * @return MimePart instance.
     * @throws IOException Unable to read.
     */
    private MimePart parseEntity(List<byte[]> lines) throws IOException {
        MimeHeaders headers = new MimeHeaders();
        int bodyStart = parseHeaders(lines, headers);
        List<byte[]> body = lines.subList(bodyStart, lines.size());

        MimeHeader contentType = headers.get("Content-Type").orElse(null);
        String type = contentType != null ? contentType.getCleanValue() : MimePart.DEFAULT_CONTENT_TYPE;

        if (type.startsWith("multipart/")) {
            String boundary = contentType.getParameter("boundary");
            if (StringUtils.isNotBlank(boundary)) {
                return parseMultipart(headers, body, boundary);
            }
            log.warn("Multipart part without boundary kept as a single part: {}", contentType.getValue());
        }

        if (type.startsWith("text/")) {
            return new TextMimePart(headers, join(body));
        }

        return new FileMimePart(headers, join(body));
    }

    /**
     * Parses headers up to and including the blank line ending them.
     *
     * @param lines   Entity lines.
     * @param headers MimeHeaders to fill.
     * @return Index of the first body line.
     */
    private int parseHeaders(List<byte[]> lines, MimeHeaders headers) {
        StringBuilder header = new StringBuilder();
        int index = 0;
        while (index < lines.size()) {
            byte[] bytes = lines.get(index++);
            String line = new String(bytes, StandardCharsets.ISO_8859_1);

            // Break if found end of headers.
            if (terminatorOf(bytes).length() == line.length()) {
                break;
            }

            // If line doesn't start with a whitespace
            // we need to produce a header from what we got so far
            // if any.
            if (!Character.isWhitespace(line.charAt(0)) && header.length() > 0) {
                headers.put(new MimeHeader(header.toString()));
                header = new StringBuilder();
            }

            header.append(line);
        }

        // Last header.
        if (header.length() > 0) {
            headers.put(new MimeHeader(header.toString()));
        }

        return index;
    }

    /**
     * Splits a multipart body on its boundary and parses each part.
     *
     * @param headers  Container headers.
     * @param body     Body lines.
     * @param boundary Boundary string.
     * @return MultipartMimePart instance.
     * @throws IOException Unable to read.
     */
    private MultipartMimePart parseMultipart(MimeHeaders headers, List<byte[]> body, String boundary) throws IOException {
        String delimiter = "--" + boundary;
        String closeDelimiter = delimiter + "--";

        List<MimePart> parts = new ArrayList<>();
        List<byte[]> section = new ArrayList<>();
        String preamble = null;
        String epilogue = null;
        String closeTerminator = "";
        boolean inPreamble = true;
        boolean closed = false;

        int index = 0;
        while (index < body.size()) {
            byte[] bytes = body.get(index++);
            String line = StringUtils.stripEnd(new String(bytes, StandardCharsets.ISO_8859_1), null);

            boolean isClose = line.equals(closeDelimiter);
            if (isClose || line.equals(delimiter)) {
                // The line break before a delimiter belongs to the delimiter.
                List<byte[]> content = stripLastTerminator(section);
                if (inPreamble) {
                    preamble = content.isEmpty() ? null : new String(join(content), StandardCharsets.ISO_8859_1);
                    inPreamble = false;
                } else {
                    parts.add(parseEntity(content));
                }
                section = new ArrayList<>();

                if (isClose) {
                    closeTerminator = terminatorOf(bytes);
                    closed = true;
                    break;
                }
                continue;
            }

            section.add(bytes);
        }

        if (closed) {
            epilogue = closeTerminator + new String(join(body.subList(index, body.size())), StandardCharsets.ISO_8859_1);
        } else if (inPreamble) {
            log.warn("Multipart boundary never found: {}", boundary);
            preamble = section.isEmpty() ? null : new String(join(stripLastTerminator(section)), StandardCharsets.ISO_8859_1);
        } else {
            log.warn("Multipart closing boundary missing: {}", boundary);
            parts.add(parseEntity(stripLastTerminator(section)));
        }

        return new MultipartMimePart(headers, parts, preamble, epilogue);
    }

    /**
     * Copies lines removing the EOL of the last one.
     *
     * @param lines Lines.
     * @return New list.
     */
    private static List<byte[]> stripLastTerminator(List<byte[]> lines) {
        List<byte[]> list = new ArrayList<>(lines);
        if (!list.isEmpty()) {
            byte[] last = list.get(list.size() - 1);
            int length = last.length - terminatorOf(last).length();
            list.set(list.size() - 1, Arrays.copyOf(last, length));
        }
        return list;
    }

    /**
     * Gets EOL characters at the end of a line.
     *
     * @param bytes Line bytes.
     * @return EOL string, empty if none.
     */
    private static String terminatorOf(byte[] bytes) {
        int end = bytes.length;
        int start = end;
        while (start > 0 && (bytes[start - 1] == '\n' || bytes[start - 1] == '\r') && end - start < 2) {
            start--;
        }
        return new String(bytes, start, end - start, StandardCharsets.ISO_8859_1);
    }

    /**
     * Concatenates lines.
     *
     * @param lines Lines.
     * @return Byte array.
     */
    private static byte[] join(List<byte[]> lines) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        for (byte[] line : lines) {
            baos.writeBytes(line);
        }
        return baos.toByteArray();
    }
}

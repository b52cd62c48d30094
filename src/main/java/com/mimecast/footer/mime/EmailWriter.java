package com.mimecast.footer.mime;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.parts.ContentMimePart;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * EmailWriter encodes a tree of MIME parts into RFC 2822 wire format.
 * <p>
 * Each multipart container writes its own boundary delimited children, so nesting follows the tree:
 * <pre>
 * multipart/mixed
 *   multipart/alternative
 *     text/plain
 *     multipart/related
 *       text/html
 *       image/png
 *   application/pdf
 * </pre>
 * Headers and text outside of parts are written as ISO-8859-1 so parsed bytes survive unchanged.
 * <p>
 * Example usage:
 * <pre>
 * ByteArrayOutputStream output = new ByteArrayOutputStream();
 * new EmailWriter(parser.getLineSeparator()).writeTo(message, output);
 * </pre>
 *
 * @see EmailParser
 */
public class EmailWriter {

    /**
     * Line separator for structure lines.
     */
    private final String separator;

    /**
     * Constructs a new EmailWriter instance writing CRLF line endings.
     */
    public EmailWriter() {
        this("\r\n");
    }

    /**
     * Constructs a new EmailWriter instance.
     *
     * @param separator Line separator.
     */
    public EmailWriter(String separator) {
        this.separator = separator;
    }

    /**
     * Encodes a part into a byte array.
     *
     * @param part MimePart instance.
     * @return Byte array.
     * @throws IOException Unable to write.
     */
    public byte[] toByteArray(MimePart part) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        writeTo(part, baos);
        return baos.toByteArray();
    }

    /**
     * Writes a part with its headers and body.
     *
     * @param part         MimePart instance.
     * @param outputStream OutputStream to write to.
     * @return Self for method chaining.
     * @throws IOException Unable to write.
     */
    public EmailWriter writeTo(MimePart part, OutputStream outputStream) throws IOException {
        if (part.getUnixFrom() != null) {
            write(outputStream, part.getUnixFrom() + separator);
        }

        for (MimeHeader header : part.getHeaders().get()) {
            write(outputStream, header.toString(separator));
        }
        write(outputStream, separator);

        if (part instanceof MultipartMimePart) {
            writeMultipart((MultipartMimePart) part, outputStream);
        } else {
            ((ContentMimePart) part).writeBody(outputStream, separator);
        }

        return this;
    }

    /**
     * Writes preamble, boundary delimited children and epilogue.
     *
     * @param multipart    MultipartMimePart instance.
     * @param outputStream OutputStream to write to.
     * @throws IOException Unable to write.
     */
    private void writeMultipart(MultipartMimePart multipart, OutputStream outputStream) throws IOException {
        String delimiter = "--" + multipart.getBoundary();

        if (multipart.getPreamble() != null) {
            write(outputStream, multipart.getPreamble() + separator);
        }

        for (MimePart child : multipart.getParts()) {
            write(outputStream, delimiter + separator);
            writeTo(child, outputStream);
            write(outputStream, separator);
        }

        // Parsed epilogues start with the closing line break.
        write(outputStream, delimiter + "--");
        write(outputStream, multipart.getEpilogue() != null ? multipart.getEpilogue() : separator);
    }

    /**
     * Writes text as ISO-8859-1.
     *
     * @param outputStream OutputStream to write to.
     * @param text         Text.
     * @throws IOException Unable to write.
     */
    private static void write(OutputStream outputStream, String text) throws IOException {
        outputStream.write(text.getBytes(StandardCharsets.ISO_8859_1));
    }
}

package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;
import org.apache.commons.codec.binary.Base64;

import javax.mail.MessagingException;
import javax.mail.internet.MimeUtility;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Leaf MIME part with a body.
 *
 * <p>Parsed parts keep the body as transmitted and decode it on demand.
 * <p>Built parts keep decoded content and are base64 encoded when written.
 */
public abstract class ContentMimePart extends MimePart {

    /**
     * Base64 line length.
     */
    private static final int BASE64_LINE_LENGTH = 76;

    /**
     * Body as transmitted, transfer encoding applied. Null for built parts.
     */
    private final byte[] body;

    /**
     * Decoded content. Null for parsed parts.
     */
    private final byte[] content;

    /**
     * Constructs a new ContentMimePart instance holding a transmitted body.
     *
     * @param headers MimeHeaders instance.
     * @param body    Transmitted body bytes.
     */
    protected ContentMimePart(MimeHeaders headers, byte[] body) {
        this(headers, body, null);
    }

    /**
     * Constructs a new ContentMimePart instance.
     *
     * @param headers MimeHeaders instance.
     * @param body    Transmitted body bytes or null.
     * @param content Decoded content or null.
     */
    protected ContentMimePart(MimeHeaders headers, byte[] body, byte[] content) {
        super(headers);
        this.body = body;
        this.content = content;
    }

    /**
     * Gets transfer encoding in lower case, 7bit if not set.
     *
     * @return Encoding name.
     */
    public String getTransferEncoding() {
        MimeHeader header = getHeader("Content-Transfer-Encoding");
        if (header == null || header.getCleanValue().isEmpty()) {
            return "7bit";
        }
        return header.getCleanValue();
    }

    /**
     * Gets decoded content bytes.
     *
     * @return Byte array.
     * @throws IOException Unknown or broken transfer encoding.
     */
    public byte[] getBytes() throws IOException {
        if (content != null) {
            return content.clone();
        }

        try (InputStream decoded = MimeUtility.decode(new ByteArrayInputStream(body), getTransferEncoding())) {
            return decoded.readAllBytes();
        } catch (MessagingException e) {
            throw new IOException("Unable to decode " + getTransferEncoding() + " body: " + e.getMessage(), e);
        }
    }

    /**
     * Writes body in transmission form.
     *
     * @param outputStream OutputStream instance.
     * @param separator    Line separator for encoded lines.
     * @throws IOException Unable to write.
     */
    public void writeBody(OutputStream outputStream, String separator) throws IOException {
        if (body != null) {
            outputStream.write(body);
            return;
        }

        byte[] sep = separator.getBytes(StandardCharsets.US_ASCII);
        String encoded = new String(new Base64(BASE64_LINE_LENGTH, sep).encode(content), StandardCharsets.US_ASCII);
        if (encoded.endsWith(separator)) {
            encoded = encoded.substring(0, encoded.length() - separator.length());
        }
        outputStream.write(encoded.getBytes(StandardCharsets.US_ASCII));
    }
}

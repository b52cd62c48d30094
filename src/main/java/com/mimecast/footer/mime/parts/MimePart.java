package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;

/**
 * MIME part.
 *
 * <p>Base of the message tree. A message is its root part, holding the message headers.
 * <p>Parts handed out by the parser or built by the rewriter are not modified afterwards.
 *
 * @see ContentMimePart
 * @see MultipartMimePart
 */
public abstract class MimePart {

    /**
     * Default content type for parts without a Content-Type header (RFC 2045).
     */
    public static final String DEFAULT_CONTENT_TYPE = "text/plain";

    /**
     * Default charset for text parts without a charset parameter (RFC 2045).
     */
    public static final String DEFAULT_CHARSET = "us-ascii";

    /**
     * Part headers.
     */
    protected final MimeHeaders headers;

    /**
     * Mbox envelope line preceding the headers, root part only.
     */
    private String unixFrom;

    /**
     * Constructs a new MimePart instance.
     *
     * @param headers MimeHeaders instance.
     */
    protected MimePart(MimeHeaders headers) {
        this.headers = headers;
    }

    /**
     * Gets headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeaders() {
        return headers;
    }

    /**
     * Gets mbox envelope line.
     *
     * @return Line without terminator, example: From sender@example.com Mon Feb 27 10:00:00 2012, or null.
     */
    public String getUnixFrom() {
        return unixFrom;
    }

    /**
     * Sets mbox envelope line.
     * <p>Set once by whoever builds the root, before handing it out.
     *
     * @param unixFrom Line without terminator or null.
     * @return Self.
     */
    public MimePart setUnixFrom(String unixFrom) {
        this.unixFrom = unixFrom;
        return this;
    }

    /**
     * Gets first header by name.
     *
     * @param name Header name.
     * @return MimeHeader instance or null.
     */
    public MimeHeader getHeader(String name) {
        return headers.get(name).orElse(null);
    }

    /**
     * Gets content type without parameters in lower case.
     *
     * @return Content type string.
     */
    public String getContentType() {
        MimeHeader header = getHeader("Content-Type");
        if (header == null || header.getCleanValue().isEmpty()) {
            return DEFAULT_CONTENT_TYPE;
        }
        return header.getCleanValue();
    }

    /**
     * Gets charset parameter of the Content-Type header.
     *
     * @return Charset name.
     */
    public String getCharset() {
        MimeHeader header = getHeader("Content-Type");
        if (header != null) {
            String charset = header.getParameter("charset");
            if (charset != null && !charset.isEmpty()) {
                return charset;
            }
        }
        return DEFAULT_CHARSET;
    }

    /**
     * Checks if content type matches.
     *
     * @param contentType Content type, example: text/plain.
     * @return Boolean.
     */
    public boolean isContentType(String contentType) {
        return getContentType().equalsIgnoreCase(contentType);
    }

    /**
     * Is multipart.
     *
     * @return Boolean.
     */
    public boolean isMultipart() {
        return false;
    }
}

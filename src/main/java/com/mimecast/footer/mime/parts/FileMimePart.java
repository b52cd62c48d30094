package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.UnsupportedEncodingException;

/**
 * Non-text leaf MIME part.
 *
 * <p>Attachments, images and anything else the rewriter carries through untouched.
 */
public class FileMimePart extends ContentMimePart {
    private static final Logger log = LogManager.getLogger(FileMimePart.class);

    /**
     * Constructs a new FileMimePart instance from a transmitted body.
     *
     * @param headers MimeHeaders instance.
     * @param body    Transmitted body bytes.
     */
    public FileMimePart(MimeHeaders headers, byte[] body) {
        super(headers, body);
    }

    /**
     * Constructs a new FileMimePart instance from decoded content.
     *
     * @param headers MimeHeaders instance.
     * @param body    Always null.
     * @param content Decoded content.
     */
    private FileMimePart(MimeHeaders headers, byte[] body, byte[] content) {
        super(headers, body, content);
    }

    /**
     * Builds an image part referenced by Content-ID, base64 transfer encoded.
     *
     * @param content   Image bytes.
     * @param subtype   Image subtype, example: png.
     * @param contentId Content-ID including angle brackets.
     * @param filename  Display filename.
     * @return FileMimePart instance.
     */
    public static FileMimePart createImage(byte[] content, String subtype, String contentId, String filename) {
        MimeHeaders headers = new MimeHeaders()
                .put(new MimeHeader("Content-Type", "image/" + subtype))
                .put(new MimeHeader("MIME-Version", "1.0"))
                .put(new MimeHeader("Content-Transfer-Encoding", "base64"))
                .put(new MimeHeader("Content-ID", contentId))
                .put(new MimeHeader("Content-Disposition", "attachment; filename=\"" + encodeFilename(filename) + "\""));

        return new FileMimePart(headers, null, content.clone());
    }

    /**
     * Encodes a filename for use as a quoted parameter value.
     * <p>Non-ASCII names become RFC 2047 encoded words on a single line.
     *
     * @param filename Filename.
     * @return Encoded filename.
     */
    static String encodeFilename(String filename) {
        String encoded;
        try {
            encoded = MimeUtility.encodeText(filename, "UTF-8", null).replace("\r\n ", " ");
        } catch (UnsupportedEncodingException e) {
            log.warn("Unable to encode filename: {}", e.getMessage());
            encoded = filename;
        }

        return encoded.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

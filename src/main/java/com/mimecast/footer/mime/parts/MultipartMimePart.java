package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Multipart MIME part.
 *
 * <p>Holds ordered children plus the free text before the first and after the closing boundary.
 * <p>Never modified in place, changes are made by building a new container around the same children.
 */
public class MultipartMimePart extends MimePart {

    /**
     * Child parts in order.
     */
    private final List<MimePart> parts;

    /**
     * Text before the first boundary, without its final line break, or null.
     */
    private final String preamble;

    /**
     * Raw text after the closing boundary, starting with the line break ending the boundary line, or null.
     */
    private final String epilogue;

    /**
     * Constructs a new MultipartMimePart instance.
     *
     * @param headers  MimeHeaders instance including a Content-Type with boundary.
     * @param parts    Child parts.
     * @param preamble Preamble or null.
     * @param epilogue Epilogue or null.
     */
    public MultipartMimePart(MimeHeaders headers, List<MimePart> parts, String preamble, String epilogue) {
        super(headers);
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        this.preamble = preamble;
        this.epilogue = epilogue;
    }

    /**
     * Builds a new multipart container with a generated boundary.
     *
     * @param subtype Multipart subtype, example: alternative.
     * @param parts   Child parts.
     * @return MultipartMimePart instance.
     */
    public static MultipartMimePart create(String subtype, List<MimePart> parts) {
        MimeHeaders headers = new MimeHeaders()
                .put(new MimeHeader("Content-Type", "multipart/" + subtype + "; boundary=\"" + newBoundary() + "\""))
                .put(new MimeHeader("MIME-Version", "1.0"));

        return new MultipartMimePart(headers, parts, null, null);
    }

    /**
     * Generates a unique boundary.
     *
     * @return Boundary string.
     */
    public static String newBoundary() {
        return "=_footer_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Gets boundary parameter.
     *
     * @return Boundary string or null.
     */
    public String getBoundary() {
        MimeHeader header = getHeader("Content-Type");
        return header != null ? header.getParameter("boundary") : null;
    }

    /**
     * Gets child parts.
     *
     * @return Unmodifiable list of MimePart.
     */
    public List<MimePart> getParts() {
        return parts;
    }

    /**
     * Gets preamble.
     *
     * @return Preamble string or null.
     */
    public String getPreamble() {
        return preamble;
    }

    /**
     * Gets epilogue.
     *
     * @return Epilogue string or null.
     */
    public String getEpilogue() {
        return epilogue;
    }

    /**
     * Is multipart.
     *
     * @return Boolean.
     */
    @Override
    public boolean isMultipart() {
        return true;
    }
}

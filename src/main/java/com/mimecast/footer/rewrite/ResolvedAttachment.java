package com.mimecast.footer.rewrite;

import com.mimecast.footer.mime.parts.FileMimePart;

/**
 * Image loaded for a Content-ID reference.
 */
public final class ResolvedAttachment {

    private final byte[] content;

    /**
     * Content-ID including angle brackets.
     */
    private final String contentId;

    private final String filename;

    /**
     * Image subtype, example: png.
     */
    private final String subtype;

    /**
     * Constructs a new ResolvedAttachment instance.
     *
     * @param content   Image bytes.
     * @param contentId Content-ID including angle brackets.
     * @param filename  Display filename.
     * @param subtype   Image subtype.
     */
    public ResolvedAttachment(byte[] content, String contentId, String filename, String subtype) {
        this.content = content;
        this.contentId = contentId;
        this.filename = filename;
        this.subtype = subtype;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public String getContentId() {
        return contentId;
    }

    /**
     * Gets Content-ID as used in cid: URIs.
     *
     * @return Content-ID without angle brackets.
     */
    public String getCid() {
        return contentId.replaceAll("^<|>$", "");
    }

    public String getFilename() {
        return filename;
    }

    public String getSubtype() {
        return subtype;
    }

    /**
     * Builds the MIME part for this image.
     *
     * @return FileMimePart instance.
     */
    public FileMimePart toMimePart() {
        return FileMimePart.createImage(content, subtype, contentId, filename);
    }
}

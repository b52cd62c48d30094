package com.mimecast.footer.rewrite;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Image formats recognised from their leading bytes.
 */
public enum ImageType {
    JPEG("jpeg"),
    PNG("png"),
    GIF("gif"),
    BMP("bmp"),
    TIFF("tiff"),
    WEBP("webp");

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};

    /**
     * MIME subtype.
     */
    private final String subtype;

    ImageType(String subtype) {
        this.subtype = subtype;
    }

    /**
     * Gets MIME subtype, example: png for image/png.
     *
     * @return Subtype string.
     */
    public String getSubtype() {
        return subtype;
    }

    /**
     * Detects image format.
     *
     * @param bytes Image bytes.
     * @return Optional of ImageType, empty if not recognised.
     */
    public static Optional<ImageType> detect(byte[] bytes) {
        if (startsWith(bytes, new byte[]{(byte) 0xff, (byte) 0xd8, (byte) 0xff})) {
            return Optional.of(JPEG);
        }
        if (startsWith(bytes, PNG_SIGNATURE)) {
            return Optional.of(PNG);
        }
        if (startsWith(bytes, ascii("GIF87a")) || startsWith(bytes, ascii("GIF89a"))) {
            return Optional.of(GIF);
        }
        if (startsWith(bytes, ascii("BM"))) {
            return Optional.of(BMP);
        }
        if (startsWith(bytes, ascii("MM\0*")) || startsWith(bytes, ascii("II*\0"))) {
            return Optional.of(TIFF);
        }
        if (startsWith(bytes, ascii("RIFF")) && bytes.length >= 12
                && new String(bytes, 8, 4, StandardCharsets.US_ASCII).equals("WEBP")) {
            return Optional.of(WEBP);
        }

        return Optional.empty();
    }

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}

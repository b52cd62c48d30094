package com.mimecast.footer.rewrite;

/**
 * Referenced image could not be loaded or identified.
 */
public class ImageResolutionException extends RewriteException {

    /**
     * Image source attribute value as found in the HTML.
     */
    private final String source;

    /**
     * Constructs a new ImageResolutionException instance.
     *
     * @param source  Image source attribute value.
     * @param message Error message.
     */
    public ImageResolutionException(String source, String message) {
        super("image resolver", message);
        this.source = source;
    }

    /**
     * Constructs a new ImageResolutionException instance.
     *
     * @param source  Image source attribute value.
     * @param message Error message.
     * @param cause   Cause.
     */
    public ImageResolutionException(String source, String message, Throwable cause) {
        super("image resolver", message, cause);
        this.source = source;
    }

    /**
     * Gets failing image source.
     *
     * @return Source attribute value.
     */
    public String getSource() {
        return source;
    }
}

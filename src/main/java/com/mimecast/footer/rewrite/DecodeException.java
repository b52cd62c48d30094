package com.mimecast.footer.rewrite;

/**
 * Text body could not be decoded, transfer encoding or charset.
 */
public class DecodeException extends RewriteException {

    /**
     * Constructs a new DecodeException instance.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public DecodeException(String message, Throwable cause) {
        super("decoder", message, cause);
    }
}

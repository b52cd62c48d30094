package com.mimecast.footer.rewrite;

/**
 * Message has no text/plain part where one is required.
 */
public class StructuralException extends RewriteException {

    /**
     * Constructs a new StructuralException instance.
     *
     * @param message Error message.
     */
    public StructuralException(String message) {
        super("rewriter", message);
    }
}

package com.mimecast.footer.rewrite;

import com.mimecast.footer.mime.parts.MimePart;

/**
 * Outcome of a conditional rewrite.
 */
public final class RewriteResult {

    /**
     * Rewritten message, or the original when not altered.
     */
    private final MimePart message;

    private final boolean altered;

    /**
     * Constructs a new RewriteResult instance.
     *
     * @param message Resulting message.
     * @param altered Was the message altered.
     */
    public RewriteResult(MimePart message, boolean altered) {
        this.message = message;
        this.altered = altered;
    }

    public MimePart getMessage() {
        return message;
    }

    public boolean isAltered() {
        return altered;
    }
}

package com.mimecast.footer.rewrite;

/**
 * Failure of a message rewrite.
 *
 * <p>Any failure aborts the whole rewrite. The caller decides between forwarding the original and rejecting it.
 * <p>Carries the failing component and, once known, the Message-ID of the message being rewritten.
 */
public class RewriteException extends Exception {

    /**
     * Component that failed.
     */
    private final String component;

    /**
     * Message-ID of the failing message, if known.
     */
    private String messageId;

    /**
     * Constructs a new RewriteException instance.
     *
     * @param component Failing component name.
     * @param message   Error message.
     */
    public RewriteException(String component, String message) {
        super(message);
        this.component = component;
    }

    /**
     * Constructs a new RewriteException instance.
     *
     * @param component Failing component name.
     * @param message   Error message.
     * @param cause     Cause.
     */
    public RewriteException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }

    /**
     * Gets failing component name.
     *
     * @return Component name.
     */
    public String getComponent() {
        return component;
    }

    /**
     * Gets Message-ID of the failing message.
     *
     * @return Message-ID or null.
     */
    public String getMessageId() {
        return messageId;
    }

    /**
     * Sets Message-ID of the failing message.
     *
     * @param messageId Message-ID.
     */
    void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    /**
     * Gets message prefixed with component and Message-ID.
     *
     * @return Message string.
     */
    @Override
    public String getMessage() {
        return component + ": " + super.getMessage() + (messageId != null ? " [Message-ID " + messageId + "]" : "");
    }
}

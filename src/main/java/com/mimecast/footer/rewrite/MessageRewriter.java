package com.mimecast.footer.rewrite;

import com.mimecast.footer.config.FooterConfig;
import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;
import com.mimecast.footer.mime.parts.TextMimePart;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites messages whose signature carries a literal HTML region.
 * <p>
 * Only the first text/plain part is considered: the root itself when single part,
 * otherwise the first text/plain child of the root container.
 * <p>
 * Single part messages get a new multipart/alternative root holding the original headers,
 * except Content-* ones which described the old body.
 * <br>Multipart messages get the text/plain child replaced by a multipart/alternative,
 * all sibling parts kept in place.
 * <p>
 * The input tree is never modified. Any failure aborts the rewrite with a {@link RewriteException}.
 *
 * @see BodyAssembler
 */
public class MessageRewriter {
    private static final Logger log = LogManager.getLogger(MessageRewriter.class);

    private final FooterConfig config;
    private final SignatureSplitter splitter = new SignatureSplitter();

    /**
     * Right hand side of generated Content-IDs, resolved once as it may need a host name lookup.
     */
    private final String contentIdDomain;

    /**
     * Constructs a new MessageRewriter instance.
     *
     * @param config FooterConfig instance.
     */
    public MessageRewriter(FooterConfig config) {
        this.config = config;
        this.contentIdDomain = config.getContentIdDomain();
    }

    /**
     * Decides if the message should be rewritten.
     *
     * @param message Root MimePart.
     * @return EligibilityDecision instance.
     * @throws DecodeException The text/plain part could not be decoded.
     */
    public EligibilityDecision checkEligibility(MimePart message) throws DecodeException {
        TextMimePart plain = findPlainPart(message);
        if (plain == null) {
            return EligibilityDecision.ineligible();
        }

        String signature;
        try {
            signature = splitter.split(textOf(plain)).getRight();
        } catch (DecodeException e) {
            e.setMessageId(messageIdOf(message));
            throw e;
        }

        return new EligibilityDecision(TextClassifier.hasHtmlMarker(signature), signature);
    }

    /**
     * Checks if the message should be rewritten.
     *
     * @param message Root MimePart.
     * @return Boolean.
     * @throws DecodeException The text/plain part could not be decoded.
     */
    public boolean isEligible(MimePart message) throws DecodeException {
        return checkEligibility(message).isEligible();
    }

    /**
     * Rewrites the message if eligible.
     *
     * @param message Root MimePart.
     * @return RewriteResult with the original message if not altered.
     * @throws RewriteException Unable to rewrite.
     */
    public RewriteResult rewriteIfEligible(MimePart message) throws RewriteException {
        String messageId = messageIdOf(message);

        if (!isEligible(message)) {
            log.info("Msg({}): nothing to alter", messageId);
            return new RewriteResult(message, false);
        }

        MimePart rewritten = rewrite(message);
        log.info("Msg({}): altered", messageId);
        return new RewriteResult(rewritten, true);
    }

    /**
     * Rewrites the message unconditionally.
     *
     * @param message Root MimePart.
     * @return New root MimePart.
     * @throws RewriteException Unable to rewrite.
     */
    public MimePart rewrite(MimePart message) throws RewriteException {
        BodyAssembler assembler = new BodyAssembler(
                new ImageResolver(config.getImagePath()),
                new ContentIdGenerator(contentIdDomain));

        try {
            if (message instanceof MultipartMimePart) {
                log.debug("multipart message");
                return rewriteMultipart((MultipartMimePart) message, assembler);
            }

            log.debug("plain message");
            return rewriteSinglePart(message, assembler);

        } catch (RewriteException e) {
            if (e.getMessageId() == null) {
                e.setMessageId(messageIdOf(message));
            }
            throw e;
        }
    }

    /**
     * Replaces the first text/plain child.
     *
     * @param message   Root container.
     * @param assembler BodyAssembler instance.
     * @return New root container sharing all other children.
     * @throws RewriteException Unable to rewrite.
     */
    private MimePart rewriteMultipart(MultipartMimePart message, BodyAssembler assembler) throws RewriteException {
        List<MimePart> children = new ArrayList<>(message.getParts());
        int index = indexOfPlainPart(message);
        if (index < 0) {
            throw new StructuralException("No text/plain part in " + message.getContentType() + " message");
        }

        children.set(index, assemble((TextMimePart) children.get(index), assembler));

        MimeHeaders headers = new MimeHeaders(message.getHeaders());
        addAuditHeader(headers);

        return new MultipartMimePart(headers, children, message.getPreamble(), message.getEpilogue())
                .setUnixFrom(message.getUnixFrom());
    }

    /**
     * Builds a multipart/alternative root around the rewritten body.
     *
     * @param message   Single part root.
     * @param assembler BodyAssembler instance.
     * @return New root container.
     * @throws RewriteException Unable to rewrite.
     */
    private MimePart rewriteSinglePart(MimePart message, BodyAssembler assembler) throws RewriteException {
        if (!(message instanceof TextMimePart) || !message.isContentType("text/plain")) {
            throw new StructuralException("Single part message is " + message.getContentType() + ", not text/plain");
        }

        MultipartMimePart alternative = assemble((TextMimePart) message, assembler);

        MimeHeaders headers = new MimeHeaders();
        for (MimeHeader header : message.getHeaders().get()) {
            if (!header.getName().toLowerCase().startsWith("content-")) {
                headers.put(header);
            }
        }
        if (headers.get("MIME-Version").isEmpty()) {
            headers.put(new MimeHeader("MIME-Version", "1.0"));
        }
        headers.put(alternative.getHeader("Content-Type"));
        addAuditHeader(headers);

        return new MultipartMimePart(headers, alternative.getParts(), config.getPreamble(), null)
                .setUnixFrom(message.getUnixFrom());
    }

    /**
     * Splits and assembles a text/plain part.
     *
     * @param plain     TextMimePart instance.
     * @param assembler BodyAssembler instance.
     * @return multipart/alternative part.
     * @throws RewriteException Unable to rewrite.
     */
    private MultipartMimePart assemble(TextMimePart plain, BodyAssembler assembler) throws RewriteException {
        Pair<String, String> split = splitter.split(textOf(plain));
        return assembler.assemble(split.getLeft(), split.getRight());
    }

    /**
     * Adds the audit header if enabled.
     *
     * @param headers MimeHeaders to add to.
     */
    private void addAuditHeader(MimeHeaders headers) {
        if (!config.isXHeader()) {
            return;
        }

        log.debug("add {} header", config.getXHeaderName());
        String value = config.getXHeaderValue();
        try {
            headers.put(new MimeHeader(config.getXHeaderName(), MimeUtility.encodeText(value)));
        } catch (UnsupportedEncodingException e) {
            log.warn("Unable to encode header value: {}", e.getMessage());
            headers.put(new MimeHeader(config.getXHeaderName(), value));
        }
    }

    /**
     * Finds the text/plain part eligibility is based on.
     *
     * @param message Root MimePart.
     * @return TextMimePart instance or null.
     */
    private static TextMimePart findPlainPart(MimePart message) {
        if (message instanceof MultipartMimePart) {
            int index = indexOfPlainPart((MultipartMimePart) message);
            return index >= 0 ? (TextMimePart) ((MultipartMimePart) message).getParts().get(index) : null;
        }

        if (message instanceof TextMimePart && message.isContentType("text/plain")) {
            return (TextMimePart) message;
        }

        return null;
    }

    /**
     * Gets index of the first text/plain child.
     *
     * @param multipart MultipartMimePart instance.
     * @return Index or -1.
     */
    private static int indexOfPlainPart(MultipartMimePart multipart) {
        List<MimePart> parts = multipart.getParts();
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i) instanceof TextMimePart && parts.get(i).isContentType("text/plain")) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Decodes part text with LF line endings.
     *
     * @param part TextMimePart instance.
     * @return Text.
     * @throws DecodeException Unable to decode.
     */
    private static String textOf(TextMimePart part) throws DecodeException {
        try {
            return part.getText().replaceAll("\r\n?", "\n");
        } catch (IOException e) {
            throw new DecodeException(e.getMessage(), e);
        }
    }

    /**
     * Gets Message-ID header value for logging.
     *
     * @param message Root MimePart.
     * @return Message-ID or empty string.
     */
    private static String messageIdOf(MimePart message) {
        MimeHeader header = message.getHeader("Message-ID");
        return header != null ? header.getValue() : "";
    }
}

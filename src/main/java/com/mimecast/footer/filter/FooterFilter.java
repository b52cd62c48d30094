package com.mimecast.footer.filter;

import com.mimecast.footer.config.FooterConfig;
import com.mimecast.footer.mime.EmailParser;
import com.mimecast.footer.mime.EmailWriter;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.rewrite.MessageRewriter;
import com.mimecast.footer.rewrite.RewriteException;
import com.mimecast.footer.rewrite.RewriteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Message filter.
 *
 * <p>Decodes a wire format message, rewrites it if eligible and encodes the result.
 * <p>Messages not altered are returned as received, byte for byte.
 * <p>The output uses the line separator of the input.
 */
public class FooterFilter {
    private static final Logger log = LogManager.getLogger(FooterFilter.class);

    private final MessageRewriter rewriter;

    /**
     * Constructs a new FooterFilter instance.
     *
     * @param config FooterConfig instance.
     */
    public FooterFilter(FooterConfig config) {
        this.rewriter = new MessageRewriter(config);
    }

    /**
     * Filters one message.
     *
     * @param input Message bytes.
     * @return Filtered message bytes.
     * @throws IOException      Unable to decode or encode.
     * @throws RewriteException Unable to rewrite.
     */
    public byte[] filter(byte[] input) throws IOException, RewriteException {
        EmailParser parser = new EmailParser(input);
        MimePart message = parser.parse();

        RewriteResult result = rewriter.rewriteIfEligible(message);
        if (!result.isAltered()) {
            return input;
        }

        byte[] output = new EmailWriter(parser.getLineSeparator()).toByteArray(result.getMessage());
        log.debug("Filtered message from {} to {} bytes", input.length, output.length);

        return output;
    }
}

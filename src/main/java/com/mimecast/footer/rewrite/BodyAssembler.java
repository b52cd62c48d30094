package com.mimecast.footer.rewrite;

import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;
import com.mimecast.footer.mime.parts.TextMimePart;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the plain and HTML alternatives of a text body.
 * <p>
 * Plain alternative: content, the signature delimiter and the plain signature lines.
 * Literal HTML lines are left out so the plain text never shows markup.
 * <p>
 * HTML alternative: content as preformatted text followed by the signature segments in order,
 * plain segments preformatted and literal HTML segments as they are.
 * <p>
 * Resulting structure:
 * <pre>
 * multipart/alternative
 *   text/plain
 *   text/html
 *
 * multipart/alternative
 *   text/plain
 *   multipart/related
 *     text/html
 *     image/png
 *     image/jpeg
 * </pre>
 */
public class BodyAssembler {
    private static final Logger log = LogManager.getLogger(BodyAssembler.class);

    private final TextClassifier classifier = new TextClassifier();
    private final ImageResolver imageResolver;
    private final ContentIdGenerator contentIds;

    /**
     * Constructs a new BodyAssembler instance.
     *
     * @param imageResolver ImageResolver instance.
     * @param contentIds    Content-ID source for the message being assembled.
     */
    public BodyAssembler(ImageResolver imageResolver, ContentIdGenerator contentIds) {
        this.imageResolver = imageResolver;
        this.contentIds = contentIds;
    }

    /**
     * Assembles both alternatives.
     *
     * @param content   Text before the signature.
     * @param signature Signature text after the delimiter line.
     * @return multipart/alternative part.
     * @throws ImageResolutionException A referenced image could not be loaded.
     */
    public MultipartMimePart assemble(String content, String signature) throws ImageResolutionException {
        List<TextSegment> segments = classifier.classify(signature);
        log.debug("Signature classified in {} segments", segments.size());

        List<MimePart> alternatives = new ArrayList<>();
        alternatives.add(TextMimePart.create(buildPlain(content, segments), "plain"));
        alternatives.add(buildHtml(content, segments));

        return MultipartMimePart.create("alternative", alternatives);
    }

    /**
     * Builds plain text.
     *
     * @param content  Text before the signature.
     * @param segments Signature segments.
     * @return Plain text.
     */
    String buildPlain(String content, List<TextSegment> segments) {
        StringBuilder plain = new StringBuilder(content)
                .append(SignatureSplitter.DELIMITER).append('\n');

        for (TextSegment segment : segments) {
            if (!segment.isHtml()) {
                plain.append(segment.getText());
            }
        }

        return plain.toString();
    }

    /**
     * Builds HTML document.
     *
     * @param content  Text before the signature.
     * @param segments Signature segments.
     * @return HTML document text.
     */
    String buildHtmlDocument(String content, List<TextSegment> segments) {
        HyperTextDocument document = new HyperTextDocument().addText(content);

        for (TextSegment segment : segments) {
            if (segment.isHtml()) {
                document.addHtml(segment.getText());
            } else {
                document.addText(segment.getText());
            }
        }

        return document.build();
    }

    /**
     * Builds HTML part, wrapped with its images when any are referenced.
     *
     * @param content  Text before the signature.
     * @param segments Signature segments.
     * @return text/html or multipart/related part.
     * @throws ImageResolutionException A referenced image could not be loaded.
     */
    private MimePart buildHtml(String content, List<TextSegment> segments) throws ImageResolutionException {
        String html = buildHtmlDocument(content, segments);

        if (!ImageResolver.hasResolvableImages(html)) {
            return TextMimePart.create(html, "html");
        }

        Pair<String, List<ResolvedAttachment>> resolved = imageResolver.resolve(html, contentIds);
        log.debug("Wrapping HTML with {} images", resolved.getRight().size());

        List<MimePart> related = new ArrayList<>();
        related.add(TextMimePart.create(resolved.getLeft(), "html"));
        for (ResolvedAttachment attachment : resolved.getRight()) {
            related.add(attachment.toMimePart());
        }

        return MultipartMimePart.create("related", related);
    }
}

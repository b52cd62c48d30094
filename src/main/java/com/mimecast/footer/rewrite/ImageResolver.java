package com.mimecast.footer.rewrite;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces local image references with Content-ID references.
 *
 * <p>Handles sources without scheme or with the file scheme. Only the file name is used,
 * <br>looked up in the configured image directory.
 * <p>Other sources, remote URLs and inline data included, are left as they are.
 * <p>Any image that cannot be loaded fails the whole resolution, nothing is partially rewritten.
 *
 * @see ImageReference
 */
public class ImageResolver {
    private static final Logger log = LogManager.getLogger(ImageResolver.class);

    /**
     * Directory images are loaded from.
     */
    private final Path imageDir;

    /**
     * Constructs a new ImageResolver instance.
     *
     * @param imageDir Directory images are loaded from.
     */
    public ImageResolver(Path imageDir) {
        this.imageDir = imageDir;
    }

    /**
     * Checks if any image tag references a local file.
     *
     * @param html HTML text.
     * @return Boolean.
     */
    public static boolean hasResolvableImages(String html) {
        return ImageReference.findAll(html).stream().anyMatch(ImageReference::isResolvable);
    }

    /**
     * Loads referenced images and rewrites their tags.
     *
     * @param html        HTML text.
     * @param contentIds  Content-ID source for this message.
     * @return Pair of rewritten HTML and loaded images in document order.
     * @throws ImageResolutionException An image is missing, unreadable or not a known image format.
     */
    public Pair<String, List<ResolvedAttachment>> resolve(String html, ContentIdGenerator contentIds) throws ImageResolutionException {
        List<ResolvedAttachment> attachments = new ArrayList<>();
        StringBuilder rewritten = new StringBuilder();

        int last = 0;
        for (ImageReference reference : ImageReference.findAll(html)) {
            if (!reference.isResolvable()) {
                log.debug("Leaving image source as is: {}", reference.getSource());
                continue;
            }

            ResolvedAttachment attachment = load(reference, contentIds.next());
            attachments.add(attachment);

            rewritten.append(html, last, reference.getStart())
                    .append(reference.withContentId(attachment.getCid()));
            last = reference.getEnd();
        }
        rewritten.append(html.substring(last));

        return Pair.of(rewritten.toString(), attachments);
    }

    /**
     * Loads one image.
     *
     * @param reference ImageReference instance.
     * @param contentId Content-ID for the image.
     * @return ResolvedAttachment instance.
     * @throws ImageResolutionException Unable to load or identify image.
     */
    private ResolvedAttachment load(ImageReference reference, String contentId) throws ImageResolutionException {
        String filename = reference.getFilename();
        if (StringUtils.isBlank(filename)) {
            throw new ImageResolutionException(reference.getSource(), "No file name in image source: " + reference.getSource());
        }

        Path file = imageDir.resolve(filename);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ImageResolutionException(reference.getSource(), "Unable to read image " + file + " for " + reference.getSource(), e);
        }

        ImageType type = ImageType.detect(bytes)
                .orElseThrow(() -> new ImageResolutionException(reference.getSource(), "Unknown image format: " + file));

        log.debug("Resolved image {} as {} with {} bytes", reference.getSource(), contentId, bytes.length);
        return new ResolvedAttachment(bytes, contentId, filename, type.getSubtype());
    }
}

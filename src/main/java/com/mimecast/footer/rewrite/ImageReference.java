package com.mimecast.footer.rewrite;

import org.apache.commons.io.FilenameUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Image tag found in an HTML fragment.
 *
 * <p>Tags are only matched within a single line.
 * <br>Holds the tag location and the pieces needed to rebuild it with another source.
 */
public final class ImageReference {

    /**
     * Image tag split in: text up to the opening quote, source value, closing quote to end of tag.
     */
    private static final Pattern IMG_TAG = Pattern.compile("(<img[ \\t][^>\\n]*src=\")([^\"\\n]+)(\"[^>\\n]*>)");

    /**
     * URI scheme prefix for sources that do not parse as URIs.
     */
    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*):");

    private final int start;
    private final int end;
    private final String prefix;
    private final String source;
    private final String suffix;

    /**
     * URI scheme in lower case or null.
     */
    private final String scheme;

    /**
     * URI path component, may be empty.
     */
    private final String path;

    /**
     * Constructs a new ImageReference instance from a tag match.
     *
     * @param matcher Matcher positioned on a tag.
     */
    private ImageReference(Matcher matcher) {
        this.start = matcher.start();
        this.end = matcher.end();
        this.prefix = matcher.group(1);
        this.source = matcher.group(2);
        this.suffix = matcher.group(3);

        String parsedScheme;
        String parsedPath;
        try {
            URI uri = new URI(source);
            parsedScheme = uri.getScheme();
            parsedPath = uri.isOpaque() ? uri.getSchemeSpecificPart() : uri.getPath();
        } catch (URISyntaxException e) {
            // Lenient fallback for unescaped sources, example: spaces in file names.
            Matcher schemeMatcher = SCHEME.matcher(source);
            parsedScheme = schemeMatcher.find() ? schemeMatcher.group(1) : null;
            parsedPath = source.substring(parsedScheme != null ? parsedScheme.length() + 1 : 0).split("[?#]", 2)[0];
        }
        this.scheme = parsedScheme != null ? parsedScheme.toLowerCase() : null;
        this.path = parsedPath != null ? parsedPath : "";
    }

    /**
     * Finds all image tags.
     *
     * @param html HTML text.
     * @return References in document order.
     */
    public static List<ImageReference> findAll(String html) {
        List<ImageReference> list = new ArrayList<>();
        Matcher matcher = IMG_TAG.matcher(html);
        while (matcher.find()) {
            list.add(new ImageReference(matcher));
        }
        return list;
    }

    /**
     * Is the source a local file reference.
     * <p>True for a non-empty path without scheme or with the file scheme.
     *
     * @return Boolean.
     */
    public boolean isResolvable() {
        return !path.isEmpty() && (scheme == null || scheme.equals("file"));
    }

    /**
     * Gets last path segment.
     *
     * @return File name, empty if path ends with a separator.
     */
    public String getFilename() {
        return FilenameUtils.getName(path);
    }

    /**
     * Rebuilds the tag pointing at a Content-ID.
     *
     * @param contentId Content-ID without angle brackets.
     * @return Tag text.
     */
    public String withContentId(String contentId) {
        return prefix + "cid:" + contentId + suffix;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getSource() {
        return source;
    }

    public String getScheme() {
        return scheme;
    }

    public String getPath() {
        return path;
    }
}

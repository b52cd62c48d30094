package com.mimecast.footer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Footer filter configuration.
 *
 * <p>This class provides type safe access to the rewrite settings.
 * <p>Instances are passed to the rewriter explicitly, there is no global configuration state.
 *
 * <p>Example footer.json5:
 * <pre>
 * {
 *   // Directory holding images referenced from signatures.
 *   imagePath: "/var/lib/html_footer",
 *   xHeader: true
 * }
 * </pre>
 */
public class FooterConfig extends ConfigFoundation {
    private static final Logger log = LoggerFactory.getLogger(FooterConfig.class);

    /**
     * Version stamped into the audit header.
     */
    public static final String VERSION = "20120227";

    /**
     * Constructs a new FooterConfig instance with defaults.
     */
    public FooterConfig() {
        super();
    }

    /**
     * Constructs a new FooterConfig instance.
     *
     * @param map Configuration map.
     */
    public FooterConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new FooterConfig instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public FooterConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets directory images are loaded from.
     *
     * @return Path instance.
     */
    public Path getImagePath() {
        return Paths.get(getStringProperty("imagePath", "/var/lib/html_footer"));
    }

    /**
     * Sets directory images are loaded from.
     *
     * @param imagePath Directory path.
     * @return Self.
     */
    public FooterConfig setImagePath(String imagePath) {
        map.put("imagePath", imagePath);
        return this;
    }

    /**
     * Is audit header enabled.
     *
     * @return Boolean.
     */
    public boolean isXHeader() {
        return getBooleanProperty("xHeader", true);
    }

    /**
     * Gets audit header name.
     *
     * @return Header name.
     */
    public String getXHeaderName() {
        return getStringProperty("xHeaderName", "X-Modified-By");
    }

    /**
     * Gets audit header value.
     *
     * @return Header value.
     */
    public String getXHeaderValue() {
        return getStringProperty("xHeaderValue", "Html Footer " + VERSION);
    }

    /**
     * Gets preamble for multipart roots replacing a single part message.
     *
     * @return Preamble text.
     */
    public String getPreamble() {
        return getStringProperty("preamble", "This is a multi-part message in MIME format...");
    }

    /**
     * Gets domain used on the right side of generated Content-IDs.
     * <p>Defaults to the local host name.
     *
     * @return Domain string.
     */
    public String getContentIdDomain() {
        if (hasProperty("contentIdDomain")) {
            return getStringProperty("contentIdDomain", "localhost");
        }

        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve local host name, using localhost: {}", e.getMessage());
            return "localhost";
        }
    }
}

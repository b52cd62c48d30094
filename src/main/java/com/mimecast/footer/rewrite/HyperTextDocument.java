package com.mimecast.footer.rewrite;

import org.apache.commons.lang3.StringUtils;

/**
 * HTML document builder for the HTML alternative.
 *
 * <p>Plain text is wrapped in a preformatted block with a monospace style, literal HTML is copied verbatim.
 * <p>Subclasses may provide another document header for a different layout.
 */
public class HyperTextDocument {

    /**
     * Default document header up to and including the opening body tag.
     */
    public static final String HTML_HEADER =
            "<!DOCTYPE HTML PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\"\n" +
            "    \"http://www.w3.org/TR/html4/loose.dtd\">\n" +
            "<html>\n" +
            "<head>\n" +
            "<meta http-equiv=\"content-type\" content=\"text/html; charset=UTF-8\">\n" +
            "<style type=\"text/css\">\n" +
            "#plaintext      {\n" +
            "    font-family:Fixedsys,Courier,monospace;\n" +
            "    padding:10px;\n" +
            "    white-space:pre-wrap;\n" +
            "}\n" +
            "</style>\n" +
            "</head>\n" +
            "<body>\n";

    /**
     * Document footer.
     */
    public static final String HTML_FOOTER = "</body>\n</html>";

    private static final String[] ESCAPE_SEARCH = {"&", "<", ">"};
    private static final String[] ESCAPE_REPLACE = {"&amp;", "&lt;", "&gt;"};

    private final StringBuilder html;

    /**
     * Constructs a new HyperTextDocument instance with the default header.
     */
    public HyperTextDocument() {
        this(HTML_HEADER);
    }

    /**
     * Constructs a new HyperTextDocument instance.
     *
     * @param header Document header up to and including the opening body tag.
     */
    public HyperTextDocument(String header) {
        this.html = new StringBuilder(header);
    }

    /**
     * Adds plain text as a preformatted block.
     *
     * @param text Plain text.
     * @return Self.
     */
    public HyperTextDocument addText(String text) {
        html.append("<pre id=\"plaintext\">\n")
                .append(StringUtils.replaceEach(text, ESCAPE_SEARCH, ESCAPE_REPLACE))
                .append("</pre>\n");
        return this;
    }

    /**
     * Adds HTML without modification.
     *
     * @param markup HTML text.
     * @return Self.
     */
    public HyperTextDocument addHtml(String markup) {
        html.append(markup);
        return this;
    }

    /**
     * Gets complete document.
     *
     * @return HTML text.
     */
    public String build() {
        return html + HTML_FOOTER;
    }
}

package com.mimecast.footer.filter;

import com.mimecast.footer.config.FooterConfig;
import com.mimecast.footer.mime.EmailParser;
import com.mimecast.footer.mime.parts.FileMimePart;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;
import com.mimecast.footer.mime.parts.TextMimePart;
import com.mimecast.footer.rewrite.ImageResolutionException;
import com.mimecast.footer.rewrite.RewriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FooterFilterTest {

    static final String dir = "src/test/resources/";

    private FooterConfig config;

    @BeforeEach
    void before() {
        Map<String, Object> map = new HashMap<>();
        map.put("contentIdDomain", "example.com");
        config = new FooterConfig(map).setImagePath(dir + "images");
    }

    @Test
    @DisplayName("Ineligible message is returned as is")
    void ineligible() throws IOException, RewriteException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/nested.eml"));

        assertSame(input, new FooterFilter(config).filter(input));
    }

    @Test
    @DisplayName("Single part message with image")
    void singlePart() throws IOException, RewriteException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/plain-html-signature.eml"));

        byte[] output = new FooterFilter(config).filter(input);
        String text = new String(output, StandardCharsets.US_ASCII);

        assertTrue(text.startsWith("From: Sender <sender@example.com>\r\n"));
        assertTrue(text.contains("\r\nX-Modified-By: Html Footer 20120227\r\n"));
        assertTrue(text.contains("\r\nContent-Type: multipart/alternative; boundary="));
        assertFalse(text.contains("Content-Type: text/plain; charset=\"us-ascii\""));

        MultipartMimePart root = (MultipartMimePart) new EmailParser(output).parse();
        String plain = ((TextMimePart) root.getParts().get(0)).getText();
        assertEquals("Hello,\n\nThe figures are attached to the shared folder.\n\n-- \nBest regards,\nSender\nExample Ltd.\n", plain);

        MultipartMimePart related = (MultipartMimePart) root.getParts().get(1);
        String html = ((TextMimePart) related.getParts().get(0)).getText();
        FileMimePart image = (FileMimePart) related.getParts().get(1);
        String cid = image.getHeader("Content-ID").getValue().replaceAll("^<|>$", "");

        assertTrue(html.contains("<a href=\"https://www.example.com/\"><img alt=\"Example\" src=\"cid:" + cid + "\" width=\"88\"></a>\n"));
        assertTrue(html.contains("<pre id=\"plaintext\">\nExample Ltd.\n</pre>"));
        assertEquals("image/gif", image.getContentType());
        assertArrayEquals(Files.readAllBytes(Paths.get(dir + "images/logo.gif")), image.getBytes());
    }

    @Test
    @DisplayName("Multipart message keeps its attachment")
    void multipart() throws IOException, RewriteException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/mixed-pdf.eml"));

        byte[] output = new FooterFilter(config).filter(input);
        String text = new String(output, StandardCharsets.US_ASCII);

        assertTrue(text.contains("--report-boundary\r\n" +
                "Content-Type: application/pdf; name=\"report.pdf\"\r\n" +
                "Content-Disposition: attachment; filename=\"report.pdf\"\r\n" +
                "Content-Transfer-Encoding: base64\r\n" +
                "\r\n" +
                "JVBERi0xLjQK\r\n" +
                "--report-boundary--\r\n"));

        MultipartMimePart root = (MultipartMimePart) new EmailParser(output).parse();
        assertEquals(2, root.getParts().size());
        MultipartMimePart alternative = (MultipartMimePart) root.getParts().get(0);
        assertEquals("Please find the report attached.\n\n-- \nCafé Team\n", ((TextMimePart) alternative.getParts().get(0)).getText());
        assertTrue(((TextMimePart) alternative.getParts().get(1)).getText().contains("<i>Caf&eacute; Team</i>\n"));
    }

    @Test
    @DisplayName("Line feed input gives line feed output")
    void lineFeed() throws IOException, RewriteException {
        String email = "Subject: Hi\n" +
                "\n" +
                "Hi\n" +
                "-- \n" +
                "<html>\n" +
                "<hr>\n" +
                "</html>\n";

        byte[] output = new FooterFilter(config).filter(email.getBytes(StandardCharsets.US_ASCII));

        assertFalse(new String(output, StandardCharsets.US_ASCII).contains("\r"));
    }

    @Test
    @DisplayName("Mbox envelope line and kept headers come out unchanged")
    void unixFrom() throws IOException, RewriteException {
        String email = "From sender@example.com Mon Feb 27 10:00:00 2012\n" +
                "Subject:Hi\n" +
                "\n" +
                "Hi\n" +
                "-- \n" +
                "<html>\n" +
                "<hr>\n" +
                "</html>\n";

        byte[] output = new FooterFilter(config).filter(email.getBytes(StandardCharsets.US_ASCII));
        String text = new String(output, StandardCharsets.US_ASCII);

        assertTrue(text.startsWith("From sender@example.com Mon Feb 27 10:00:00 2012\nSubject:Hi\n"), text);
        assertTrue(text.contains("\nContent-Type: multipart/alternative; boundary="));

        MimePart root = new EmailParser(output).parse();
        assertEquals("From sender@example.com Mon Feb 27 10:00:00 2012", root.getUnixFrom());
        assertEquals("Hi", root.getHeader("Subject").getValue());
    }

    @Test
    @DisplayName("Mbox envelope line kept on multipart message")
    void unixFromMultipart() throws IOException, RewriteException {
        byte[] pdf = Files.readAllBytes(Paths.get(dir + "mime/mixed-pdf.eml"));
        byte[] envelope = "From sender@example.com Mon Feb 27 10:00:00 2012\r\n".getBytes(StandardCharsets.US_ASCII);
        byte[] input = new byte[envelope.length + pdf.length];
        System.arraycopy(envelope, 0, input, 0, envelope.length);
        System.arraycopy(pdf, 0, input, envelope.length, pdf.length);

        String text = new String(new FooterFilter(config).filter(input), StandardCharsets.US_ASCII);

        assertTrue(text.startsWith("From sender@example.com Mon Feb 27 10:00:00 2012\r\nFrom: sender@example.com\r\n"), text);
    }

    @Test
    @DisplayName("Missing image fails")
    void missingImage() {
        String email = "Subject: Hi\r\n" +
                "\r\n" +
                "Hi\r\n" +
                "-- \r\n" +
                "<html>\r\n" +
                "<img src=\"missing.png\">\r\n" +
                "</html>\r\n";

        assertThrows(ImageResolutionException.class, () -> new FooterFilter(config).filter(email.getBytes(StandardCharsets.US_ASCII)));
    }
}

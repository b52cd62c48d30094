package com.mimecast.footer.mime;

import com.mimecast.footer.mime.parts.FileMimePart;
import com.mimecast.footer.mime.parts.MimePart;
import com.mimecast.footer.mime.parts.MultipartMimePart;
import com.mimecast.footer.mime.parts.TextMimePart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class EmailParserTest {

    static final String dir = "src/test/resources/mime/";

    @Test
    @DisplayName("Parse single part message")
    void singlePart() throws IOException {
        EmailParser parser = new EmailParser(new FileInputStream(dir + "plain-html-signature.eml"));
        MimePart message = parser.parse();

        assertInstanceOf(TextMimePart.class, message);
        assertEquals("\r\n", parser.getLineSeparator());
        assertEquals("<plain.1@example.com>", message.getHeader("Message-ID").getValue());
        assertTrue(((TextMimePart) message).getText().startsWith("Hello,\r\n"));
    }

    @Test
    @DisplayName("Parse nested multipart message")
    void nested() throws IOException {
        MimePart message = new EmailParser(new FileInputStream(dir + "nested.eml")).parse();

        assertInstanceOf(MultipartMimePart.class, message);
        MultipartMimePart mixed = (MultipartMimePart) message;
        assertEquals("mixed-boundary", mixed.getBoundary());
        assertEquals("This is a multi-part message in MIME format.", mixed.getPreamble());
        assertEquals("\r\nTrailing epilogue text.\r\n", mixed.getEpilogue());
        assertEquals(2, mixed.getParts().size());

        MultipartMimePart alternative = (MultipartMimePart) mixed.getParts().get(0);
        assertEquals("multipart/alternative", alternative.getContentType());
        assertNull(alternative.getPreamble());
        assertEquals(2, alternative.getParts().size());
        assertEquals("Plain body.", ((TextMimePart) alternative.getParts().get(0)).getText());
        assertEquals("text/html", alternative.getParts().get(1).getContentType());

        FileMimePart pdf = (FileMimePart) mixed.getParts().get(1);
        assertEquals("application/pdf", pdf.getContentType());
        assertEquals("%PDF-1.4\n", new String(pdf.getBytes(), StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("Detect LF line endings")
    void lineFeed() throws IOException {
        String email = "Subject: Test\n" +
                "\n" +
                "Body\n";

        EmailParser parser = new EmailParser(email.getBytes(StandardCharsets.US_ASCII));
        MimePart message = parser.parse();

        assertEquals("\n", parser.getLineSeparator());
        assertEquals("Test", message.getHeader("Subject").getValue());
        assertEquals("Body\n", ((TextMimePart) message).getText());
    }

    @Test
    @DisplayName("Keep mbox envelope line on the root")
    void unixFrom() throws IOException {
        String email = "From sender@example.com Mon Feb 27 10:00:00 2012\n" +
                "From: sender@example.com\n" +
                "Subject:Hi\n" +
                "\n" +
                "Body\n";

        EmailParser parser = new EmailParser(email.getBytes(StandardCharsets.US_ASCII));
        MimePart message = parser.parse();

        assertEquals("From sender@example.com Mon Feb 27 10:00:00 2012", message.getUnixFrom());
        assertEquals("sender@example.com", message.getHeader("From").getValue());
        assertEquals(2, message.getHeaders().size());

        byte[] written = new EmailWriter(parser.getLineSeparator()).toByteArray(message);
        assertEquals(email, new String(written, StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("From header is not an envelope line")
    void fromHeader() {
        assertTrue(EmailParser.isUnixFrom("From MAILER-DAEMON Mon Feb 27 10:00:00 2012\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmailParser.isUnixFrom("From: sender@example.com\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmailParser.isUnixFrom("From : sender@example.com\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmailParser.isUnixFrom(">From sender@example.com\r\n".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    @DisplayName("Missing closing boundary keeps last part")
    void unclosed() throws IOException {
        String email = "Content-Type: multipart/mixed; boundary=\"b\"\r\n" +
                "\r\n" +
                "--b\r\n" +
                "\r\n" +
                "one\r\n" +
                "--b\r\n" +
                "\r\n" +
                "two\r\n";

        MultipartMimePart message = (MultipartMimePart) new EmailParser(email.getBytes(StandardCharsets.US_ASCII)).parse();

        assertEquals(2, message.getParts().size());
        assertEquals("two", ((TextMimePart) message.getParts().get(1)).getText());
        assertNull(message.getEpilogue());
    }

    @Test
    @DisplayName("Multipart without boundary is kept as single part")
    void noBoundary() throws IOException {
        String email = "Content-Type: multipart/mixed\r\n" +
                "\r\n" +
                "--b\r\n";

        MimePart message = new EmailParser(email.getBytes(StandardCharsets.US_ASCII)).parse();

        assertFalse(message.isMultipart());
    }

    @Test
    @DisplayName("Write back unchanged")
    void roundTrip() throws IOException {
        for (String file : new String[]{"plain-html-signature.eml", "nested.eml", "mixed-pdf.eml"}) {
            byte[] bytes = Files.readAllBytes(Paths.get(dir + file));
            EmailParser parser = new EmailParser(bytes);
            MimePart message = parser.parse();

            byte[] written = new EmailWriter(parser.getLineSeparator()).toByteArray(message);

            assertEquals(new String(bytes, StandardCharsets.ISO_8859_1), new String(written, StandardCharsets.ISO_8859_1), file);
        }
    }
}

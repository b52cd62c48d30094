package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TextMimePartTest {

    private static TextMimePart part(String contentType, String encoding, String body) {
        MimeHeaders headers = new MimeHeaders();
        if (contentType != null) {
            headers.put(new MimeHeader("Content-Type", contentType));
        }
        if (encoding != null) {
            headers.put(new MimeHeader("Content-Transfer-Encoding", encoding));
        }
        return new TextMimePart(headers, body.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    @DisplayName("Defaults to text/plain us-ascii 7bit")
    void defaults() throws IOException {
        TextMimePart part = part(null, null, "Hello\r\n");

        assertEquals("text/plain", part.getContentType());
        assertEquals("us-ascii", part.getCharset());
        assertEquals("7bit", part.getTransferEncoding());
        assertEquals("Hello\r\n", part.getText());
    }

    @Test
    @DisplayName("Decode quoted-printable UTF-8")
    void quotedPrintable() throws IOException {
        TextMimePart part = part("text/plain; charset=\"utf-8\"", "quoted-printable", "Caf=C3=A9 soft=\r\nbreak\r\n");

        assertEquals("Café softbreak\r\n", part.getText());
    }

    @Test
    @DisplayName("Decode base64")
    void base64() throws IOException {
        TextMimePart part = part("text/plain; charset=utf-8", "base64", "SGVsbG8K\r\n");

        assertEquals("Hello\n", part.getText());
    }

    @Test
    @DisplayName("Unknown charset fails")
    void unknownCharset() {
        TextMimePart part = part("text/plain; charset=\"x-no-such-charset\"", null, "Hello");

        assertThrows(UnsupportedEncodingException.class, part::getText);
    }

    @Test
    @DisplayName("Malformed content fails")
    void malformed() {
        TextMimePart part = part("text/plain; charset=\"utf-8\"", "8bit", "Café");

        assertThrows(IOException.class, part::getText);
    }

    @Test
    @DisplayName("Built part is written as base64 lines")
    void created() throws IOException {
        TextMimePart part = TextMimePart.create("x".repeat(100), "html");

        assertEquals("text/html", part.getContentType());
        assertEquals("utf-8", part.getCharset());
        assertEquals("x".repeat(100), part.getText());

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        part.writeBody(output, "\n");
        String[] lines = output.toString(StandardCharsets.US_ASCII).split("\n");

        assertEquals(2, lines.length);
        assertEquals(76, lines[0].length());
    }
}

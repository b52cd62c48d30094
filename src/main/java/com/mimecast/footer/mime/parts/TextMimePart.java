package com.mimecast.footer.mime.parts;

import com.mimecast.footer.mime.headers.MimeHeader;
import com.mimecast.footer.mime.headers.MimeHeaders;

import javax.mail.internet.MimeUtility;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Text MIME part.
 *
 * <p>Decodes to a string using the declared charset, failing on anything malformed.
 */
public class TextMimePart extends ContentMimePart {

    /**
     * Constructs a new TextMimePart instance from a transmitted body.
     *
     * @param headers MimeHeaders instance.
     * @param body    Transmitted body bytes.
     */
    public TextMimePart(MimeHeaders headers, byte[] body) {
        super(headers, body);
    }

    /**
     * Constructs a new TextMimePart instance from decoded content.
     *
     * @param headers MimeHeaders instance.
     * @param body    Always null.
     * @param content Decoded content.
     */
    private TextMimePart(MimeHeaders headers, byte[] body, byte[] content) {
        super(headers, body, content);
    }

    /**
     * Builds a UTF-8 text part, base64 transfer encoded.
     *
     * @param text    Text content.
     * @param subtype Text subtype, example: plain or html.
     * @return TextMimePart instance.
     */
    public static TextMimePart create(String text, String subtype) {
        MimeHeaders headers = new MimeHeaders()
                .put(new MimeHeader("Content-Type", "text/" + subtype + "; charset=\"utf-8\""))
                .put(new MimeHeader("MIME-Version", "1.0"))
                .put(new MimeHeader("Content-Transfer-Encoding", "base64"));

        return new TextMimePart(headers, null, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Gets decoded text.
     *
     * @return Text string.
     * @throws IOException Unknown charset, malformed content or broken transfer encoding.
     */
    public String getText() throws IOException {
        Charset charset = resolveCharset(getCharset());
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(getBytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Body is not valid " + charset.name(), e);
        }
    }

    /**
     * Resolves a MIME charset name.
     * <p>Names unknown to Java are looked up as MIME aliases, example: ja_jp.iso2022-7.
     *
     * @param name Charset name.
     * @return Charset instance.
     * @throws UnsupportedEncodingException Unknown charset.
     */
    private static Charset resolveCharset(String name) throws UnsupportedEncodingException {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            try {
                return Charset.forName(MimeUtility.javaCharset(name));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                throw new UnsupportedEncodingException("Unsupported charset: " + name);
            }
        }
    }
}

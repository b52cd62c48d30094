package com.mimecast.footer.mime.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>Returns lines with their EOL bytes intact so the message can be written back unchanged.
 * <p>Accepts CRLF, bare LF and bare CR line endings.
 */
public class LineInputStream extends PushbackInputStream {

    /**
     * Carrige return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(1024);

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        super(new BufferedInputStream(stream), 1);
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array including EOL or null at end of stream.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        int intByte;
        while ((intByte = read()) != -1) {
            lineBuffer.write(intByte);

            if (intByte == LF) {
                break;
            }

            // CR ends the line, swallowing a directly following LF.
            if (intByte == CR) {
                int next = read();
                if (next == LF) {
                    lineBuffer.write(next);
                } else if (next != -1) {
                    unread(next);
                }
                break;
            }
        }

        // Return null if nothing was read.
        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }
}

/**
 * MIME message model with its decoder and encoder.
 *
 * <p>{@link com.mimecast.footer.mime.EmailParser} decodes wire format into a tree of parts
 * <br>and {@link com.mimecast.footer.mime.EmailWriter} encodes it back.
 * <p>Parts nobody touched are written back as received.
 */
package com.mimecast.footer.mime;

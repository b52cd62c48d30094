/**
 * MIME message tree.
 *
 * <p>A message is represented by its root {@link com.mimecast.footer.mime.parts.MimePart}.
 * <br>Leaves are {@link com.mimecast.footer.mime.parts.TextMimePart} or {@link com.mimecast.footer.mime.parts.FileMimePart}.
 * <br>Containers are {@link com.mimecast.footer.mime.parts.MultipartMimePart} and nest arbitrarily.
 */
package com.mimecast.footer.mime.parts;

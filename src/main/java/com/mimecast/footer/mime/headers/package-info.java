/**
 * Deals with the headers of a MIME message.
 *
 * <p>This package contains classes for working with MIME headers, including:
 * <ul>
 *   <li>{@link com.mimecast.footer.mime.headers.MimeHeader} - Container for individual MIME headers</li>
 *   <li>{@link com.mimecast.footer.mime.headers.MimeHeaders} - Ordered container for multiple MIME headers</li>
 * </ul>
 */
package com.mimecast.footer.mime.headers;

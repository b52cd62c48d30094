/**
 * Body transformation engine.
 *
 * <p>Turns a plain text message whose signature contains a literal HTML region into
 * <br>a multipart/alternative message with plain and HTML renditions.
 *
 * <p>Signature convention:
 * <pre>
 * Hello
 * --
 * Best,
 * Me
 * &lt;html&gt;
 * &lt;b&gt;Bold&lt;/b&gt; &lt;img src="logo.png"&gt;
 * &lt;/html&gt;
 * </pre>
 * The delimiter line is two dashes followed by a single space.
 * <br>Lines between the markers go into the HTML rendition as they are and are left out of the plain one.
 * <br>Local images referenced from the HTML are attached in a multipart/related part and referenced by Content-ID.
 *
 * <p>Entry point:
 * <pre>
 * RewriteResult result = new MessageRewriter(config).rewriteIfEligible(message);
 * </pre>
 *
 * @see com.mimecast.footer.rewrite.MessageRewriter
 */
package com.mimecast.footer.rewrite;

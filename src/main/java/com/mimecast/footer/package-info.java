/**
 * Html Footer mail content filter.
 *
 * <p>Rewrites plain text messages whose signature carries a literal HTML region
 * <br>into messages with plain and HTML alternatives, embedding referenced local images.
 *
 * <p>Packages:
 * <ul>
 *     <li>mime - Message model, decoder and encoder.</li>
 *     <li>rewrite - Body transformation engine.</li>
 *     <li>config - Typed configuration.</li>
 *     <li>filter - Pipe mode glue.</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>java -jar html-footer.jar --imagepath /var/lib/html_footer &lt; message.eml &gt; filtered.eml</pre>
 */
package com.mimecast.footer;

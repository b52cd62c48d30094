/**
 * Handles the configuration of the footer filter.
 *
 * <p>Provides the configuration foundation and the typed footer settings.
 *
 * <p>Configuration is a JSON5 file given with <i>--config</i>.
 * <br>The image directory can also be given on the command line with <i>--imagepath</i>, which wins over the file.
 * <br><b>Example:</b>
 * <pre>java -jar html-footer.jar --config /etc/html_footer/footer.json5 &lt; message.eml</pre>
 */
package com.mimecast.footer.config;

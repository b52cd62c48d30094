/**
 * Pipe mode message filter.
 *
 * <p>Glues the MIME decoder, the rewrite engine and the MIME encoder together for one message.
 * <p>Used by the command line runnable reading a message on standard input and writing it on standard output.
 * <br>Failures are left to the caller, which decides between forwarding the original and rejecting it.
 *
 * @see com.mimecast.footer.Main
 */
package com.mimecast.footer.filter;

package com.mimecast.footer.rewrite;

import java.util.UUID;

/**
 * Content-ID source for one assembled message.
 *
 * <p>Numbers parts from 1 and adds a random UUID so concurrent messages never collide.
 * <p>Not thread safe, use one instance per message.
 */
public class ContentIdGenerator {

    /**
     * Right hand side of generated ids.
     */
    private final String domain;

    /**
     * Next part number.
     */
    private int part = 1;

    /**
     * Constructs a new ContentIdGenerator instance.
     *
     * @param domain Domain for the right hand side.
     */
    public ContentIdGenerator(String domain) {
        this.domain = domain;
    }

    /**
     * Generates a new Content-ID.
     *
     * @return Content-ID including angle brackets.
     */
    public String next() {
        return "<part" + part++ + "." + UUID.randomUUID() + "@" + domain + ">";
    }
}

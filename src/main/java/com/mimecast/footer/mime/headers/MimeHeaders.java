package com.mimecast.footer.mime.headers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered MIME headers container.
 *
 * <p>Duplicate names are allowed and kept in the order they were added.
 * <p>Lookups are case-insensitive.
 */
public class MimeHeaders {

    /**
     * Headers in order.
     */
    private final List<MimeHeader> headers = new ArrayList<>();

    /**
     * Constructs a new empty MimeHeaders instance.
     */
    public MimeHeaders() {
        // Empty.
    }

    /**
     * Constructs a new MimeHeaders instance copying the given headers.
     *
     * @param other MimeHeaders instance.
     */
    public MimeHeaders(MimeHeaders other) {
        headers.addAll(other.headers);
    }

    /**
     * Adds header at the end.
     *
     * @param header MimeHeader instance.
     * @return Self.
     */
    public MimeHeaders put(MimeHeader header) {
        headers.add(header);
        return this;
    }

    /**
     * Gets first header with given name.
     *
     * @param name Header name.
     * @return Optional of MimeHeader.
     */
    public Optional<MimeHeader> get(String name) {
        return headers.stream()
                .filter(h -> h.isNamed(name))
                .findFirst();
    }

    /**
     * Gets all headers with given name in order.
     *
     * @param name Header name.
     * @return List of MimeHeader.
     */
    public List<MimeHeader> getAll(String name) {
        return headers.stream()
                .filter(h -> h.isNamed(name))
                .collect(Collectors.toList());
    }

    /**
     * Gets all headers.
     *
     * @return Unmodifiable list of MimeHeader.
     */
    public List<MimeHeader> get() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Gets headers which names start with given prefix, case-insensitive.
     *
     * @param prefix Name prefix.
     * @return List of MimeHeader.
     */
    public List<MimeHeader> startsWith(String prefix) {
        String lower = prefix.toLowerCase();
        return headers.stream()
                .filter(h -> h.getName().toLowerCase().startsWith(lower))
                .collect(Collectors.toList());
    }

    /**
     * Removes all headers with given name.
     *
     * @param name Header name.
     * @return Self.
     */
    public MimeHeaders remove(String name) {
        headers.removeIf(h -> h.isNamed(name));
        return this;
    }

    /**
     * Gets header count.
     *
     * @return Integer.
     */
    public int size() {
        return headers.size();
    }
}

package com.mimecast.footer.rewrite;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignatureSplitterTest {

    private final SignatureSplitter splitter = new SignatureSplitter();

    @Test
    @DisplayName("Split on delimiter line")
    void split() {
        Pair<String, String> pair = splitter.split("Hello\n-- \nBest,\nMe\n");

        assertEquals("Hello\n", pair.getLeft());
        assertEquals("Best,\nMe\n", pair.getRight());
    }

    @Test
    @DisplayName("First delimiter wins")
    void first() {
        Pair<String, String> pair = splitter.split("Hello\n-- \nOne\n-- \nTwo\n");

        assertEquals("Hello\n", pair.getLeft());
        assertEquals("One\n-- \nTwo\n", pair.getRight());
    }

    @Test
    @DisplayName("Trailing space is required")
    void noSpace() {
        Pair<String, String> pair = splitter.split("Hello\n--\nMe\n");

        assertEquals("Hello\n--\nMe\n", pair.getLeft());
        assertEquals("", pair.getRight());
    }

    @Test
    @DisplayName("Delimiter must be the whole line")
    void wholeLine() {
        Pair<String, String> pair = splitter.split("Hello\n-- not a delimiter\n x-- \n");

        assertEquals("", pair.getRight());
    }

    @Test
    @DisplayName("Delimiter on first and last line")
    void edges() {
        assertEquals(Pair.of("", "Me\n"), splitter.split("-- \nMe\n"));
        assertEquals(Pair.of("Hello\n", ""), splitter.split("Hello\n-- "));
    }
}

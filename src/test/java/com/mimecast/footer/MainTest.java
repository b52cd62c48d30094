package com.mimecast.footer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    static final String dir = "src/test/resources/";

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final ByteArrayOutputStream error = new ByteArrayOutputStream();

    private String run(byte[] input, String... args) {
        new Main(args, new ByteArrayInputStream(input), output, error).run();
        return output.toString(StandardCharsets.ISO_8859_1);
    }

    private String error() {
        return error.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Filter message from input to output")
    void filter() throws IOException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/plain-html-signature.eml"));

        String output = run(input, "--config", dir + "cfg/footer.json5");

        assertTrue(output.contains("Content-Type: multipart/alternative;"));
        assertTrue(output.contains("Content-ID: <part1."));
        assertFalse(output.contains("X-Footer"));
        assertEquals("", error());
    }

    @Test
    @DisplayName("Failure forwards the original")
    void failure() throws IOException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/plain-html-signature.eml"));

        String output = run(input, "-i", dir + "cfg");

        assertEquals(new String(input, StandardCharsets.ISO_8859_1), output);
    }

    @Test
    @DisplayName("Missing configuration file forwards the original")
    void missingConfig() throws IOException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/mixed-pdf.eml"));

        String output = run(input, "--config", dir + "cfg/absent.json5");

        assertEquals(new String(input, StandardCharsets.ISO_8859_1), output);
    }

    @Test
    @DisplayName("Version goes to standard error")
    void version() {
        assertEquals("", run(new byte[0], "--version"));
        assertEquals("html-footer.jar 20120227", error().trim());
    }

    @Test
    @DisplayName("Usage goes to standard error")
    void usage() {
        assertEquals("", run(new byte[0], "--help"));
        assertTrue(error().contains("--imagepath"));
    }

    @Test
    @DisplayName("Unknown option is rejected")
    void unknownOption() {
        assertEquals("", run(new byte[0], "--unknown"));
        assertTrue(error().startsWith("Options error: "));
    }

    @Test
    @DisplayName("Unknown debug level is rejected")
    void unknownDebugLevel() throws IOException {
        byte[] input = Files.readAllBytes(Paths.get(dir + "mime/plain-html-signature.eml"));

        assertEquals("", run(input, "--debuglevel", "chatty"));
        assertTrue(error().startsWith("Unknown debuglevel chatty"));
        assertTrue(error().contains("--debuglevel"));
    }
}

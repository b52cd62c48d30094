package com.mimecast.footer.rewrite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageReferenceTest {

    @Test
    @DisplayName("Find image tags in order")
    void findAll() {
        String html = "<p><img src=\"a.png\"> <img alt=\"b\" src=\"file:///var/b.gif\" width=\"2\"></p>";

        List<ImageReference> references = ImageReference.findAll(html);

        assertEquals(2, references.size());
        assertEquals("a.png", references.get(0).getSource());
        assertNull(references.get(0).getScheme());
        assertEquals("file", references.get(1).getScheme());
        assertEquals("/var/b.gif", references.get(1).getPath());
        assertEquals("b.gif", references.get(1).getFilename());
        assertEquals("<img alt=\"b\" src=\"file:///var/b.gif\" width=\"2\">",
                html.substring(references.get(1).getStart(), references.get(1).getEnd()));
    }

    @Test
    @DisplayName("Only local sources are resolvable")
    void resolvable() {
        String html = "<img src=\"logo.png\">\n" +
                "<img src=\"/opt/images/logo.png\">\n" +
                "<img src=\"file:logo.png\">\n" +
                "<img src=\"https://www.example.com/logo.png\">\n" +
                "<img src=\"cid:part1.abc@example.com\">\n" +
                "<img src=\"data:image/png;base64,iVBORw0KGgo=\">\n";

        List<ImageReference> references = ImageReference.findAll(html);

        assertEquals(6, references.size());
        assertTrue(references.get(0).isResolvable());
        assertTrue(references.get(1).isResolvable());
        assertTrue(references.get(2).isResolvable());
        assertFalse(references.get(3).isResolvable());
        assertFalse(references.get(4).isResolvable());
        assertFalse(references.get(5).isResolvable());
    }

    @Test
    @DisplayName("Unescaped file names are accepted")
    void unescaped() {
        ImageReference reference = ImageReference.findAll("<img src=\"my logo.png?v=2\">").get(0);

        assertTrue(reference.isResolvable());
        assertEquals("my logo.png", reference.getFilename());
    }

    @Test
    @DisplayName("Tag split over lines is not matched")
    void multiLine() {
        assertTrue(ImageReference.findAll("<img\nsrc=\"a.png\">").isEmpty());
        assertTrue(ImageReference.findAll("<img alt=\"a\"\n src=\"a.png\">").isEmpty());
    }

    @Test
    @DisplayName("Replace source only")
    void withContentId() {
        ImageReference reference = ImageReference.findAll("<img class=\"x\" src=\"a.png\" alt=\"A\">").get(0);

        assertEquals("<img class=\"x\" src=\"cid:part1.y@example.com\" alt=\"A\">", reference.withContentId("part1.y@example.com"));
    }
}

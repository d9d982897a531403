package io.cukecore.common;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    @Test
    void testMemoryResource() {
        Resource resource = Resource.text("one\r\ntwo\n\nfour");
        assertFalse(resource.isFile());
        assertNull(resource.getPath());
        assertEquals("", resource.getRelativePath());
        assertEquals("one", resource.getLine(0));
        assertEquals("two", resource.getLine(1));
        assertEquals("", resource.getLine(2));
        assertEquals("four", resource.getLine(3));
        assertEquals("", resource.getLine(4));
        assertEquals("", resource.getLine(-1));
        assertEquals("(inline)", resource.toString());
    }

    @Test
    void testNamedMemoryResource() {
        Resource resource = Resource.text("Feature: x", "some/dir/named.feature");
        assertEquals("some/dir/named.feature", resource.toString());
        assertEquals("named", resource.getFileNameWithoutExtension());
    }

    @Test
    void testPathResource() {
        Resource resource = Resource.path(Path.of("src/test/resources/features/outline.feature"));
        assertTrue(resource.isFile());
        assertEquals("src/test/resources/features/outline.feature", resource.getRelativePath());
        assertEquals("outline", resource.getFileNameWithoutExtension());
        assertEquals("Feature: Checkout", resource.getLine(1));
    }

    @Test
    void testClassPathResource() {
        Resource resource = Resource.path("classpath:features/steps.feature");
        assertFalse(resource.isFile());
        assertEquals("features/steps.feature", resource.getRelativePath());
        assertTrue(resource.getText().contains("Feature: Steps with attachments"));
    }

    @Test
    void testMissingResources() {
        assertThrows(UncheckedIOException.class, () -> Resource.path("does/not/exist.feature"));
        assertThrows(UncheckedIOException.class, () -> Resource.classPath("features/missing.feature"));
    }

}

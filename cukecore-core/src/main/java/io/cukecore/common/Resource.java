/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.cukecore.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * UTF-8 text source handed to the lexers. Reading happens when the resource
 * is created, so parsing itself never performs I/O.
 */
public interface Resource {

    String CLASSPATH_COLON = "classpath:";

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String text, String relativePath) {
        return new MemoryResource(text, relativePath);
    }

    static Resource path(Path path) {
        return new PathResource(path);
    }

    static Resource path(String path) {
        if (path.startsWith(CLASSPATH_COLON)) {
            return classPath(path.substring(CLASSPATH_COLON.length()));
        }
        return new PathResource(Path.of(path));
    }

    static Resource classPath(String name) {
        String resourceName = name.startsWith("/") ? name.substring(1) : name;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = Resource.class.getClassLoader();
        }
        try (InputStream is = cl.getResourceAsStream(resourceName)) {
            if (is == null) {
                throw new UncheckedIOException(new IOException("classpath resource not found: " + name));
            }
            return new MemoryResource(new String(is.readAllBytes(), StandardCharsets.UTF_8), resourceName);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read classpath resource: " + name, e);
        }
    }

    static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read file: " + path, e);
        }
    }

    boolean isFile();

    /**
     * @return the file path, or null for in-memory resources
     */
    Path getPath();

    String getRelativePath();

    String getText();

    /**
     * @param index 0-based line number
     * @return the line without its line terminator, or an empty string when out of range
     */
    String getLine(int index);

    default String getFileNameWithoutExtension() {
        String path = getRelativePath();
        int slash = path.lastIndexOf('/');
        if (slash != -1) {
            path = path.substring(slash + 1);
        }
        int pos = path.lastIndexOf('.');
        return pos == -1 ? path : path.substring(0, pos);
    }

    static String[] toLines(String text) {
        return text.split("\\r?\\n", -1);
    }

}

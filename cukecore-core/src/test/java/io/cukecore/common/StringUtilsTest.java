package io.cukecore.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testTruncate() {
        assertEquals("", StringUtils.truncate(null, 5, false));
        assertEquals("hello", StringUtils.truncate("hello", 5, false));
        assertEquals("hel", StringUtils.truncate("hello", 3, false));
        assertEquals("hel ...", StringUtils.truncate("hello", 3, true));
    }

    @Test
    void testTrim() {
        assertEquals("", StringUtils.trimToEmpty(null));
        assertEquals("a", StringUtils.trimToEmpty("  a \t"));
        assertNull(StringUtils.trimToNull("   "));
        assertNull(StringUtils.trimToNull(null));
        assertEquals("a b", StringUtils.trimToNull(" a b "));
        assertTrue(StringUtils.isBlank(" \t\n"));
        assertFalse(StringUtils.isBlank(" x "));
        assertEquals("  a", StringUtils.trimTrailing("  a \n\t "));
        assertEquals("", StringUtils.trimTrailing(" \n"));
    }

    @Test
    void testCountLeadingWhitespace() {
        assertEquals(0, StringUtils.countLeadingWhitespace(""));
        assertEquals(0, StringUtils.countLeadingWhitespace("a "));
        assertEquals(3, StringUtils.countLeadingWhitespace(" \t a"));
        assertEquals(2, StringUtils.countLeadingWhitespace("  "));
    }

    @Test
    void testJoin() {
        assertEquals("", StringUtils.join(List.of(), ","));
        assertEquals("a", StringUtils.join(List.of("a"), ","));
        assertEquals("a,b", StringUtils.join(List.of("a", "b"), ","));
        assertEquals(",b,", StringUtils.join(List.of("", "b", ""), ","));
    }

}

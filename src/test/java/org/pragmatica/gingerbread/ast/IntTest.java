package org.pragmatica.gingerbread.ast;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class IntTest {

    @Test
    void parseU32_acceptsFullRange() {
        assertEquals(OptionalLong.of(0), Int.parseU32("0"));
        assertEquals(OptionalLong.of(92), Int.parseU32("92"));
        assertEquals(OptionalLong.of(4294967295L), Int.parseU32("4294967295"));
    }

    @Test
    void parseU32_rejectsOverflow() {
        assertTrue(Int.parseU32("4294967296").isEmpty());
        assertTrue(Int.parseU32("9999999999999999999").isEmpty());
        assertTrue(Int.parseU32("10000000000").isEmpty());
    }

    @Test
    void parseU32_ignoresLeadingZeros() {
        assertEquals(OptionalLong.of(4294967295L), Int.parseU32("0004294967295"));
        assertEquals(OptionalLong.of(0), Int.parseU32("0000"));
    }

    @Test
    void parseU32_rejectsNonDigits() {
        assertTrue(Int.parseU32("").isEmpty());
        assertTrue(Int.parseU32("-1").isEmpty());
        assertTrue(Int.parseU32("12a").isEmpty());
    }
}

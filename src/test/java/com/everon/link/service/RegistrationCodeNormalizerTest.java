package com.everon.link.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.everon.link.support.TestFixtures;

class RegistrationCodeNormalizerTest {

    private RegistrationCodeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RegistrationCodeNormalizer(TestFixtures.properties());
    }

    @Test
    void uppercasesAndStripsWhitespace() {
        assertEquals("ABC123", normalizer.normalize("  abc123 \n").orElseThrow());
        assertEquals("ABC123", normalizer.normalize("abc 123").orElseThrow());
    }

    @Test
    void keepsInnerSeparators() {
        assertEquals("ABC-123", normalizer.normalize("abc-123").orElseThrow());
    }

    @Test
    void rejectsSeparatorAtEdges() {
        assertTrue(normalizer.normalize("-ABC123").isEmpty());
        assertTrue(normalizer.normalize("ABC123-").isEmpty());
    }

    @Test
    void rejectsForeignCharacters() {
        assertTrue(normalizer.normalize("ABC_123").isEmpty());
        assertTrue(normalizer.normalize("ABC!123").isEmpty());
        assertTrue(normalizer.normalize("ÄBC123").isEmpty());
        assertTrue(normalizer.normalize("abcß12").isEmpty());
        assertTrue(normalizer.normalize("abcıı1").isEmpty());
        assertTrue(normalizer.normalize("abcdﬁ").isEmpty());
        assertTrue(normalizer.normalize("ＡＢＣ１２３").isEmpty());
    }

    @Test
    void unicodeWhitespaceIsRemoved() {
        assertEquals("ABC123", normalizer.normalize("\u00a0abc\u2003123\t").orElseThrow());
    }

    @Test
    void lengthIsCheckedAfterWhitespaceRemoval() {
        assertTrue(normalizer.normalize("ab c12").isEmpty());
        assertEquals("ABCD12", normalizer.normalize("ab cd 12").orElseThrow());
    }

    @Test
    void rejectsWrongLength() {
        assertTrue(normalizer.normalize("AB12").isEmpty());
        assertTrue(normalizer.normalize("A".repeat(65)).isEmpty());
        assertTrue(normalizer.normalize("").isEmpty());
        assertTrue(normalizer.normalize(null).isEmpty());
    }

    @Test
    void sameCodeTypedDifferentlyNormalizesIdentically() {
        assertEquals(normalizer.normalize("abc123"), normalizer.normalize(" ABC 123 "));
    }
}

package de.bsommerfeld.scratchdb.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    @Test
    void newId_shouldBeWellFormedHex() {
        String id = Identifiers.newId();
        assertEquals(32, id.length());
        assertTrue(Identifiers.isUuid(id));
    }

    @Test
    void isUuid_shouldAcceptCanonicalAndCompactForms() {
        assertTrue(Identifiers.isUuid("123e4567-e89b-12d3-a456-426614174000"));
        assertTrue(Identifiers.isUuid("123E4567E89B12D3A456426614174000"));
    }

    @Test
    void isUuid_shouldRejectGarbage() {
        assertFalse(Identifiers.isUuid(null));
        assertFalse(Identifiers.isUuid(""));
        assertFalse(Identifiers.isUuid("card-1"));
        assertFalse(Identifiers.isUuid("123e4567e89b12d3a45642661417400"));
    }

    @Test
    void normalizeUuid_shouldStripHyphensAndLowerCase() {
        assertEquals("123e4567e89b12d3a456426614174000",
                Identifiers.normalizeUuid("123E4567-E89B-12D3-A456-426614174000"));
        assertThrows(IllegalArgumentException.class, () -> Identifiers.normalizeUuid("nope"));
    }

    @Test
    void friendlyId_shouldSlugifyTitle() {
        assertEquals("write-the-weekly-report", Identifiers.friendlyId("  Write the *weekly* report! ", "abc"));
    }

    @Test
    void friendlyId_shouldFallBackToIdPrefix() {
        assertEquals("card-1234abcd", Identifiers.friendlyId("!!!", "1234abcd-ffff"));
        assertEquals("card", Identifiers.friendlyId(null, null));
    }

    @Test
    void slugify_shouldCapLength() {
        String slug = Identifiers.slugify("a".repeat(80));
        assertEquals(50, slug.length());
    }
}

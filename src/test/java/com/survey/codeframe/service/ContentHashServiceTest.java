package com.survey.codeframe.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashServiceTest {

    private ContentHashService hashService;

    @BeforeEach
    void setUp() {
        hashService = new ContentHashService();
    }

    @Test
    void testKnownSha256() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                hashService.generateHash("hello"));
    }

    @Test
    void testHashIsStableAndTextSensitive() {
        String hash = hashService.generateHash("Colgate keeps my teeth white");

        assertEquals(64, hash.length());
        assertEquals(hash, hashService.generateHash("Colgate keeps my teeth white"));
        assertNotEquals(hash, hashService.generateHash("Colgate keeps my teeth white."));
    }

    @Test
    void testNullText() {
        assertNull(hashService.generateHash(null));
    }

    @Test
    void testHasTextChanged() {
        String a = hashService.generateHash("a");
        String b = hashService.generateHash("b");

        assertFalse(hashService.hasTextChanged(a, a));
        assertTrue(hashService.hasTextChanged(a, b));
        assertTrue(hashService.hasTextChanged(a, null));
        assertFalse(hashService.hasTextChanged(null, null));
    }
}

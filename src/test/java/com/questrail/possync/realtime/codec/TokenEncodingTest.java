package com.questrail.possync.realtime.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenEncodingTest {

    @Test
    void roundTripsTokensOfEveryPaddingLength() {
        for (int length : new int[] {1, 16, 37}) {
            String token = "t".repeat(length - 1) + "?";

            String encoded = TokenEncoding.encode(token);

            assertEquals(token, TokenEncoding.decode(encoded), "length " + length);
        }
    }

    @Test
    void encodingIsUrlSafeAndUnpadded() {
        // "fn5+Pz4+" in the standard alphabet.
        String token = "~~~?>>";

        String encoded = TokenEncoding.encode(token);

        assertFalse(encoded.contains("+"));
        assertFalse(encoded.contains("/"));
        assertFalse(encoded.contains("="));
        assertTrue(encoded.matches("[A-Za-z0-9_-]+"));
    }

    @Test
    void knownValue() {
        assertEquals("YQ", TokenEncoding.encode("a"));
        assertEquals("ZXlKaGJHY2lPaUpJVXpJMU5pSjkuYWJj", TokenEncoding.encode("eyJhbGciOiJIUzI1NiJ9.abc"));
    }
}

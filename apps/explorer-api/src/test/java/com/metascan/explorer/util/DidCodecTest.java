package com.metascan.explorer.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DidCodecTest {

    private static final String DID = "did:ssid:alice";

    @Test
    void paddedHexDecodesBackToDid() {
        String hex = DidCodec.toPaddedHex(DID);

        assertEquals(DidCodec.PADDED_HEX_LENGTH, hex.length());
        assertTrue(hex.startsWith("0x6469643a737369643a616c696365"));
        assertEquals(Optional.of(DID), DidCodec.decode(hex));
    }

    @Test
    void decodeStripsTrailingWhitespaceAndNul() {
        // "bob" + " \n" + two NUL bytes
        assertEquals(Optional.of("bob"), DidCodec.decode("0x626f62200a0000"));
    }

    @Test
    void decodeAcceptsHexWithoutPrefix() {
        assertEquals(Optional.of("bob"), DidCodec.decode("626f62"));
    }

    @Test
    void decodeRejectsNonHexAndInvalidUtf8() {
        assertEquals(Optional.empty(), DidCodec.decode("did:ssid:bob"));
        assertEquals(Optional.empty(), DidCodec.decode("0xabc"));
        assertEquals(Optional.empty(), DidCodec.decode("0xc328"));
        assertEquals(Optional.empty(), DidCodec.decode(null));
    }

    @Test
    void decodeOrRawFallsBackToInput() {
        assertEquals("did:ssid:bob", DidCodec.decodeOrRaw("did:ssid:bob"));
        assertEquals("bob", DidCodec.decodeOrRaw("0x626f62"));
    }

    @Test
    void longDidIsTruncatedToPaddedWidth() {
        String hex = DidCodec.toPaddedHex("did:ssid:" + "x".repeat(40));

        assertEquals(DidCodec.PADDED_HEX_LENGTH, hex.length());
    }

    @Test
    void hexPrefixHasNoPaddingOrPrefix() {
        assertEquals("6469643a737369643a", DidCodec.toHexPrefix("did:ssid:"));
    }
}

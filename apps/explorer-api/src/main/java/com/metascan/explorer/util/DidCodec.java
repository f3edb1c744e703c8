package com.metascan.explorer.util;

import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Conversions between the stored hex form of a DID and its human-readable text.
 *
 * <p>The indexer stores a DID as {@code 0x} + hex of its UTF-8 bytes, right-padded with zero
 * bytes to 32 bytes. Decoding strips trailing whitespace and NUL padding.</p>
 */
public final class DidCodec {

    /** {@code 0x} plus 64 hex digits. */
    public static final int PADDED_HEX_LENGTH = 66;

    private static final Pattern HEX = Pattern.compile("^(0x)?([0-9a-fA-F]{2})*$");

    private DidCodec() {
    }

    /**
     * Decodes a hex DID. Returns empty when the input is not hex or not valid UTF-8.
     */
    public static Optional<String> decode(String hex) {
        if (hex == null || !HEX.matcher(hex).matches()) {
            return Optional.empty();
        }
        byte[] bytes = Numeric.hexStringToByteArray(hex);
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return Optional.of(stripPadding(text));
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    /**
     * Decodes a hex DID, falling back to the input itself when it does not decode.
     */
    public static String decodeOrRaw(String hex) {
        return decode(hex).orElse(hex);
    }

    /**
     * Encodes a DID into the fixed-width form stored in event attributes.
     */
    public static String toPaddedHex(String did) {
        StringBuilder hex = new StringBuilder("0x")
                .append(Numeric.toHexStringNoPrefix(did.getBytes(StandardCharsets.UTF_8)));
        while (hex.length() < PADDED_HEX_LENGTH) {
            hex.append('0');
        }
        return hex.substring(0, PADDED_HEX_LENGTH);
    }

    /**
     * Hex of the raw UTF-8 bytes, without padding or prefix. Used for prefix matches on stored ids.
     */
    public static String toHexPrefix(String text) {
        return Numeric.toHexStringNoPrefix(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String stripPadding(String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n' && c != '\0') {
                break;
            }
            end--;
        }
        return text.substring(0, end);
    }
}

package com.metascan.explorer.modules.query;

import com.metascan.explorer.modules.search.BlockPosition;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parsing of detail-endpoint identifiers: numeric keys, {@code 0x} hashes and dash-joined
 * composite keys. Anything that does not parse is simply absent.
 */
public final class ItemKey {

    private ItemKey() {
    }

    public static boolean isHash(String id) {
        return id != null && id.startsWith("0x");
    }

    public static Optional<Long> asLong(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<Integer> asInt(String value) {
        return asLong(value)
                .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    /**
     * Splits {@code id} into exactly {@code segments} non-empty parts; the last part keeps any
     * further dashes.
     */
    public static Optional<List<String>> split(String id, int segments) {
        if (id == null) {
            return Optional.empty();
        }
        String[] parts = id.split("-", segments);
        if (parts.length != segments || Arrays.stream(parts).anyMatch(String::isEmpty)) {
            return Optional.empty();
        }
        return Optional.of(List.of(parts));
    }

    /**
     * {@code "<block_id>-<idx>"} as a pair of numbers.
     */
    public static Optional<BlockPosition> blockPosition(String id) {
        return split(id, 2).flatMap(parts -> asLong(parts.get(0))
                .flatMap(block -> asInt(parts.get(1)).map(idx -> new BlockPosition(block, idx))));
    }
}

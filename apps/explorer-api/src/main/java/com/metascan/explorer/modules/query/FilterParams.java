package com.metascan.explorer.modules.query;

import com.metascan.explorer.exception.InvalidFilterValueException;
import com.metascan.explorer.util.DidCodec;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The {@code filter[<field>]} parameters of one request. Fields nobody asks for are ignored.
 */
public final class FilterParams {

    public static final String SEARCH_INDEX = "search_index";
    public static final String ADDRESS = "address";

    private final MultiValueMap<String, String> params;

    private FilterParams(MultiValueMap<String, String> params) {
        this.params = params;
    }

    public static FilterParams of(MultiValueMap<String, String> params) {
        return new FilterParams(params == null ? new LinkedMultiValueMap<>() : params);
    }

    /**
     * First non-blank value of {@code filter[field]}.
     */
    public Optional<String> get(String field) {
        List<String> values = params.get(key(field));
        if (values == null) {
            return Optional.empty();
        }
        return values.stream().filter(StringUtils::hasText).findFirst();
    }

    public boolean has(String field) {
        return get(field).isPresent();
    }

    /**
     * All values of a repeatable filter; comma-separated values are split.
     */
    public List<String> getAll(String field) {
        List<String> values = params.get(key(field));
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            for (String part : StringUtils.commaDelimitedListToStringArray(value)) {
                if (StringUtils.hasText(part)) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    public List<Integer> getIntegers(String field) {
        List<Integer> result = new ArrayList<>();
        for (String value : getAll(field)) {
            try {
                result.add(Integer.valueOf(value));
            } catch (NumberFormatException e) {
                throw new InvalidFilterValueException(field, "Not an integer: " + value);
            }
        }
        return result;
    }

    /**
     * Decodes a hex-encoded DID filter into the DID text stored in the index columns.
     */
    public Optional<String> getDecodedDid(String field) {
        Optional<String> raw = get(field);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(DidCodec.decode(raw.get())
                .orElseThrow(() -> new InvalidFilterValueException(field, "Not a hex-encoded DID")));
    }

    private static String key(String field) {
        return "filter[" + field + "]";
    }
}

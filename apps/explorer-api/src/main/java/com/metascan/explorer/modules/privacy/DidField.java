package com.metascan.explorer.modules.privacy;

import lombok.Value;

/**
 * A DID-bearing field of one record.
 *
 * <p>{@code participant} fields decide who may see the record in clear; the others (a memo, a
 * signer shown alongside) are only masked along with them.</p>
 */
@Value
public class DidField {
    String role;
    String value;
    boolean participant;

    public static DidField participant(String role, String value) {
        return new DidField(role, value, true);
    }

    public static DidField companion(String role, String value) {
        return new DidField(role, value, false);
    }
}

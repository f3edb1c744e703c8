package com.metascan.explorer.modules.identity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Who is asking: anonymous, or the DID carried by a verified token.
 */
@Getter
@EqualsAndHashCode
public final class Identity {

    private static final Identity ANONYMOUS = new Identity(null);

    private final String did;

    private Identity(String did) {
        this.did = did;
    }

    public static Identity anonymous() {
        return ANONYMOUS;
    }

    public static Identity authenticated(String did) {
        if (did == null || did.isBlank()) {
            throw new IllegalArgumentException("authenticated identity requires a DID");
        }
        return new Identity(did);
    }

    public boolean isAuthenticated() {
        return did != null;
    }

    @Override
    public String toString() {
        return isAuthenticated() ? "Identity(authenticated)" : "Identity(anonymous)";
    }
}

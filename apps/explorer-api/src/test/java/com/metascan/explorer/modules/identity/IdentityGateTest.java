package com.metascan.explorer.modules.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityGateTest {

    private static final String ISSUER = "https://auth.metascan.test";
    private static final String KEY = "primary-secret";
    private static final String ROTATED_KEY = "rotated-secret";
    private static final long NOW = 1_700_000_000L;
    private static final String DID = "did:ssid:alice";

    private final IdentityGate gate = new IdentityGate(
            new ObjectMapper(),
            new ExplorerProperties.Auth(List.of(ISSUER), List.of(KEY, ROTATED_KEY)),
            Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));

    @Test
    void validTokenYieldsDidFromDataClaim() throws Exception {
        String token = token(KEY, "{\"iss\":\"" + ISSUER + "\",\"exp\":" + (NOW + 60)
                + ",\"data\":{\"did\":\"" + DID + "\"}}");

        Identity identity = gate.resolve("Bearer " + token);

        assertTrue(identity.isAuthenticated());
        assertEquals(DID, identity.getDid());
    }

    @Test
    void anyTrustedKeyVerifies() throws Exception {
        String token = token(ROTATED_KEY, "{\"iss\":\"" + ISSUER + "\",\"did\":\"" + DID + "\"}");

        assertEquals(Identity.authenticated(DID), gate.resolve("bearer " + token));
    }

    @Test
    void missingHeaderIsAnonymous() {
        assertEquals(Identity.anonymous(), gate.resolve(null));
        assertEquals(Identity.anonymous(), gate.resolve("  "));
    }

    @Test
    void untrustedKeyIsAnonymous() throws Exception {
        String token = token("someone-else", "{\"iss\":\"" + ISSUER + "\",\"did\":\"" + DID + "\"}");

        assertFalse(gate.resolve("Bearer " + token).isAuthenticated());
    }

    @Test
    void untrustedIssuerIsAnonymous() throws Exception {
        String token = token(KEY, "{\"iss\":\"https://evil.test\",\"did\":\"" + DID + "\"}");

        assertFalse(gate.resolve("Bearer " + token).isAuthenticated());
    }

    @Test
    void expiredTokenIsAnonymous() throws Exception {
        String token = token(KEY, "{\"iss\":\"" + ISSUER + "\",\"exp\":" + NOW + ",\"did\":\"" + DID + "\"}");

        assertFalse(gate.resolve("Bearer " + token).isAuthenticated());
    }

    @Test
    void tokenWithoutDidIsAnonymous() throws Exception {
        String token = token(KEY, "{\"iss\":\"" + ISSUER + "\",\"data\":{}}");

        assertFalse(gate.resolve("Bearer " + token).isAuthenticated());
    }

    @Test
    void garbageIsAnonymous() {
        assertFalse(gate.resolve("Bearer not.a.token").isAuthenticated());
        assertFalse(gate.resolve("Bearer abc").isAuthenticated());
    }

    private static String token(String key, String claims) throws Exception {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString("{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
        String payload = encoder.encodeToString(claims.getBytes(StandardCharsets.UTF_8));
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] signature = mac.doFinal((header + "." + payload).getBytes(StandardCharsets.US_ASCII));
        return header + "." + payload + "." + encoder.encodeToString(signature);
    }
}

package com.metascan.explorer.modules.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.List;

/**
 * Turns the raw {@code Authorization} header value into an {@link Identity}.
 *
 * <p>Tokens are compact HS256 JWTs. A token is accepted when one of the trusted keys verifies its
 * signature, its {@code iss} is trusted, it has not expired, and its {@code data} claim (or a
 * top-level {@code did} claim) names a DID. Any failure yields {@link Identity#anonymous()}; a
 * request never fails because of its token.</p>
 */
@Slf4j
@Component
public class IdentityGate {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String HMAC_SHA256 = "HmacSHA256";

    private final ObjectMapper objectMapper;
    private final List<String> trustedIssuers;
    private final List<String> trustedKeys;
    private final Clock clock;

    @Autowired
    public IdentityGate(ObjectMapper objectMapper, ExplorerProperties properties) {
        this(objectMapper, properties.getAuth(), Clock.systemUTC());
    }

    IdentityGate(ObjectMapper objectMapper, ExplorerProperties.Auth auth, Clock clock) {
        this.objectMapper = objectMapper;
        this.trustedIssuers = auth.getTrustedIssuers();
        this.trustedKeys = auth.getTrustedKeys();
        this.clock = clock;
    }

    public Identity resolve(String authorization) {
        String token = extractToken(authorization);
        if (token == null) {
            return Identity.anonymous();
        }
        try {
            return Identity.authenticated(verify(token));
        } catch (InvalidTokenException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            return Identity.anonymous();
        }
    }

    private String extractToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return null;
        }
        String value = authorization.trim();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            value = value.substring(BEARER_PREFIX.length()).trim();
        }
        return value.isEmpty() ? null : value;
    }

    private String verify(String token) throws InvalidTokenException {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidTokenException("malformed token");
        }
        JsonNode header = readSegment(parts[0]);
        if (!"HS256".equals(header.path("alg").asText())) {
            throw new InvalidTokenException("unsupported alg " + header.path("alg").asText());
        }
        byte[] signature = decodeSegment(parts[2]);
        byte[] signingInput = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!signedByTrustedKey(signingInput, signature)) {
            throw new InvalidTokenException("signature not verified by any trusted key");
        }

        JsonNode claims = readSegment(parts[1]);
        String issuer = claims.path("iss").asText(null);
        if (issuer == null || !trustedIssuers.contains(issuer)) {
            throw new InvalidTokenException("untrusted issuer " + issuer);
        }
        JsonNode exp = claims.get("exp");
        if (exp != null && !exp.isNull()) {
            if (!exp.canConvertToLong() || exp.asLong() <= clock.instant().getEpochSecond()) {
                throw new InvalidTokenException("token expired");
            }
        }
        String did = claims.path("data").path("did").asText(null);
        if (did == null || did.isBlank()) {
            did = claims.path("did").asText(null);
        }
        if (did == null || did.isBlank()) {
            throw new InvalidTokenException("no DID claim");
        }
        return did;
    }

    private boolean signedByTrustedKey(byte[] signingInput, byte[] signature) throws InvalidTokenException {
        for (String key : trustedKeys) {
            try {
                Mac mac = Mac.getInstance(HMAC_SHA256);
                mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
                if (MessageDigest.isEqual(mac.doFinal(signingInput), signature)) {
                    return true;
                }
            } catch (GeneralSecurityException e) {
                throw new InvalidTokenException("HMAC unavailable", e);
            }
        }
        return false;
    }

    private JsonNode readSegment(String segment) throws InvalidTokenException {
        try {
            JsonNode node = objectMapper.readTree(decodeSegment(segment));
            if (node == null || !node.isObject()) {
                throw new InvalidTokenException("token segment is not a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new InvalidTokenException("token segment is not JSON", e);
        }
    }

    private static byte[] decodeSegment(String segment) throws InvalidTokenException {
        try {
            return Base64.getUrlDecoder().decode(segment);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("token segment is not base64url", e);
        }
    }
}

package com.coedit.core.auth;

import com.coedit.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact HS256 access token codec.
 * <p>
 * <b>Token format:</b> {@code base64url(header).base64url(claims).base64url(hmac)}
 * <ul>
 *   <li>{@code header}: {@code {"alg":"HS256","typ":"JWT"}}</li>
 *   <li>{@code claims}: {@code sub} (user id), {@code username}, {@code exp} (epoch seconds)</li>
 *   <li>{@code hmac}: HMAC-SHA256 over {@code header.claims} with the cluster secret</li>
 * </ul>
 * </p>
 * <p>
 * Tokens are issued elsewhere; {@link #issue} exists for tests and local tooling.
 * </p>
 */
public final class AccessToken {
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String ALG = "HS256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private AccessToken() {
    }

    /**
     * Issues a signed token.
     *
     * @param userId    Subject
     * @param username  Display name claim (nullable)
     * @param expiresAt Expiry instant
     * @param secret    HMAC secret (must be the same across the cluster)
     * @return compact token
     */
    public static String issue(String userId, String username, Instant expiresAt, String secret) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALG);
        header.put("typ", "JWT");

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", userId);
        if (username != null) {
            claims.put("username", username);
        }
        claims.put("exp", expiresAt.getEpochSecond());

        String signingInput = encode(JsonUtils.writeValueAsString(header)) + "."
            + encode(JsonUtils.writeValueAsString(claims));
        return signingInput + "." + ENCODER.encodeToString(computeHmac(signingInput, secret));
    }

    /**
     * Verifies signature and expiry and extracts the principal.
     *
     * @param token  compact token, may be null
     * @param secret HMAC secret
     * @param now    reference time for the expiry check
     * @return authenticated principal
     * @throws AuthException with {@link AuthError#MISSING}, {@link AuthError#INVALID} or {@link AuthError#EXPIRED}
     */
    public static Principal verify(String token, String secret, Instant now) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthError.MISSING);
        }

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new AuthException(AuthError.INVALID);
        }

        JsonNode header;
        JsonNode claims;
        byte[] providedSignature;
        try {
            header = JsonUtils.mapper().readTree(DECODER.decode(parts[0]));
            claims = JsonUtils.mapper().readTree(DECODER.decode(parts[1]));
            providedSignature = DECODER.decode(parts[2]);
        } catch (Exception e) {
            throw new AuthException(AuthError.INVALID, e);
        }

        if (header == null || !ALG.equals(header.path("alg").asText())) {
            throw new AuthException(AuthError.INVALID);
        }

        byte[] expectedSignature = computeHmac(parts[0] + "." + parts[1], secret);
        if (!MessageDigest.isEqual(expectedSignature, providedSignature)) {
            throw new AuthException(AuthError.INVALID);
        }

        String userId = claims == null ? null : claims.path("sub").asText(null);
        if (userId == null || userId.isBlank()) {
            throw new AuthException(AuthError.INVALID);
        }

        JsonNode exp = claims.get("exp");
        if (exp != null && !exp.isNull()) {
            if (!exp.isNumber() || !exp.canConvertToLong()) {
                throw new AuthException(AuthError.INVALID);
            }
            if (exp.asLong() <= now.getEpochSecond()) {
                throw new AuthException(AuthError.EXPIRED);
            }
        }

        String username = claims.path("username").asText(userId);
        return new Principal(userId, username);
    }

    private static String encode(String json) {
        return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] computeHmac(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }
}

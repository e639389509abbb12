package com.assignmenttracker.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Signing key for access tokens.
 * <p>
 * {@code jwt.secret} is taken as UTF-8 bytes, or decoded as base64 when prefixed with
 * {@code base64:}. Keys shorter than {@value #MIN_KEY_LENGTH_BYTES} bytes are rejected, never
 * padded. The HMAC strength follows the key length: HS512 from 64 bytes, HS384 from 48, else HS256.
 */
@Component
public class JwtTokenProvider {

    public static final int MIN_KEY_LENGTH_BYTES = 32;
    static final String BASE64_PREFIX = "base64:";

    private final SecretKey secretKey;
    private final MacAlgorithm algorithm;

    public JwtTokenProvider(@Value("${jwt.secret:}") String secretString) {
        byte[] keyBytes = decode(secretString);
        if (keyBytes.length < MIN_KEY_LENGTH_BYTES) {
            throw new SigningKeyInvalidException("jwt.secret must be at least " + MIN_KEY_LENGTH_BYTES
                    + " bytes, got " + keyBytes.length);
        }
        this.secretKey = Keys.hmacShaKeyFor(keyBytes);
        this.algorithm = selectAlgorithm(keyBytes.length);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public MacAlgorithm getAlgorithm() {
        return algorithm;
    }

    private static byte[] decode(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new SigningKeyInvalidException("jwt.secret is not configured");
        }
        if (secretString.startsWith(BASE64_PREFIX)) {
            try {
                return Base64.getDecoder().decode(secretString.substring(BASE64_PREFIX.length()).trim());
            } catch (IllegalArgumentException ex) {
                throw new SigningKeyInvalidException("jwt.secret is not valid base64", ex);
            }
        }
        return secretString.getBytes(StandardCharsets.UTF_8);
    }

    private static MacAlgorithm selectAlgorithm(int keyLengthBytes) {
        if (keyLengthBytes >= 64) {
            return SIG.HS512;
        }
        if (keyLengthBytes >= 48) {
            return SIG.HS384;
        }
        return SIG.HS256;
    }
}

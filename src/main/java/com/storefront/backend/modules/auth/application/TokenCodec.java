package com.storefront.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Secrets handling for every auth flow: opaque random tokens, their SHA-256 digests
 * (the only form that is persisted) and BCrypt password hashes.
 */
@Component
public class TokenCodec {

    public static final int VERIFICATION_TOKEN_BYTES = 32;
    public static final int RESET_TOKEN_BYTES = 32;
    public static final int REFRESH_TOKEN_BYTES = 64;

    private static final String SHA_256 = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();
    private final PasswordEncoder passwordEncoder;

    public TokenCodec(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * @return {@code byteLength} random bytes, hex encoded (twice as many characters)
     */
    public String generateToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive");
        }
        byte[] bytes = new byte[byteLength];
        secureRandom.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    public String digest(String rawToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_256);
            return HEX.formatHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Constant-time comparison of a presented raw token against a stored digest.
     */
    public boolean matches(String rawToken, String storedDigest) {
        if (rawToken == null || storedDigest == null) {
            return false;
        }
        byte[] presented = digest(rawToken).getBytes(StandardCharsets.US_ASCII);
        byte[] stored = storedDigest.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(presented, stored);
    }

    public String hashPassword(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verifyPassword(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null) {
            return false;
        }
        return passwordEncoder.matches(plaintext, storedHash);
    }
}

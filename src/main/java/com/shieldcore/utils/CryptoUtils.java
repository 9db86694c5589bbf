package com.shieldcore.utils;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

public class CryptoUtils {

    public static final int DEFAULT_TOKEN_BYTES = 32;
    public static final int PBKDF2_ITERATIONS = 100_000;
    public static final int PBKDF2_SALT_BYTES = 16;

    private static final Pbkdf2PasswordEncoder PBKDF2 = new Pbkdf2PasswordEncoder(
            "", PBKDF2_SALT_BYTES, PBKDF2_ITERATIONS, Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);

    private CryptoUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new String(Hex.encode(digest.digest(value.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    /**
     * URL-safe, unpadded base64 of {@code byteLength} random bytes.
     */
    public static String secureToken(int byteLength) {
        byte[] bytes = KeyGenerators.secureRandom(byteLength).generateKey();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * PBKDF2-HMAC-SHA256 with a fresh random salt; the hex result carries the salt, so it can only
     * be checked with {@link #matchesHash}.
     */
    public static String pbkdf2Hash(String value) {
        return PBKDF2.encode(value);
    }

    public static boolean matchesHash(String value, String hash) {
        if (value == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return PBKDF2.matches(value, hash);
        } catch (IllegalArgumentException ex) {
            // not a hash this encoder produced
            return false;
        }
    }
}

package com.mwor.service;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Hash, HMAC and HKDF primitives shared by the seed, piece, Merkle and draw code.
 */
public final class FairnessCrypto {

    public static final int SEED_BYTES = 32;

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

    private FairnessCrypto() {
    }

    public static byte[] hmacSha256(byte[] key, String data) {
        return hmacSha256(key, data.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] hmacSha256(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 is required", ex);
        }
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }

    public static String sha256Hex(byte[] data) {
        return Hex.toHexString(sha256(data));
    }

    public static String sha256Hex(String data) {
        return sha256Hex(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * HKDF-SHA256 expansion of already uniform key material under a context label.
     */
    public static byte[] hkdf(byte[] inputKeyMaterial, String info, int length) {
        HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
        generator.init(new HKDFParameters(inputKeyMaterial, null, info.getBytes(StandardCharsets.UTF_8)));
        byte[] out = new byte[length];
        generator.generateBytes(out, 0, length);
        return out;
    }

    public static String toHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    /**
     * Decodes a 32-byte lowercase or uppercase hex value, optionally 0x-prefixed.
     *
     * @throws IllegalArgumentException when the value is not 64 hex characters
     */
    public static byte[] decodeHex32(String value) {
        return Hex.decode(normalizeHex32(value));
    }

    public static String normalizeHex32(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Hex value is required");
        }
        String trimmed = value.trim().toLowerCase();
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Value must be 64 hex characters");
        }
        return withoutPrefix;
    }

    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8)
        );
    }
}

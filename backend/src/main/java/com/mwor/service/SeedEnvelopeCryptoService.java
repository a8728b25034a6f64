package com.mwor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mwor.config.CommitSecurityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;

/**
 * Seals committed round seeds into a versioned AES-256-GCM JSON envelope so that commitment
 * storage never holds a raw seed. The key id is bound into the AAD.
 */
@Service
@RequiredArgsConstructor
public class SeedEnvelopeCryptoService {

    private static final String ENVELOPE_VERSION = "v1";
    private static final String ENVELOPE_ALGORITHM = "AES-256-GCM";
    private static final int AES_KEY_BYTES = 32;
    private static final int GCM_IV_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;

    private final CommitSecurityProperties commitSecurityProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SecureRandom secureRandom = new SecureRandom();

    public String seal(byte[] seed) {
        try {
            String keyId = activeKeyId();
            byte[] iv = new byte[GCM_IV_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, secretKey(keyId), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(aad(keyId));

            SeedEnvelope envelope = new SeedEnvelope(
                    ENVELOPE_VERSION,
                    ENVELOPE_ALGORITHM,
                    keyId,
                    Base64.getEncoder().encodeToString(iv),
                    Base64.getEncoder().encodeToString(cipher.doFinal(seed))
            );
            return objectMapper.writeValueAsString(envelope);
        } catch (IllegalArgumentException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Unable to seal committed seed", ex);
        }
    }

    public byte[] open(String storedEnvelope) {
        try {
            SeedEnvelope envelope = objectMapper.readValue(storedEnvelope, SeedEnvelope.class);
            if (!ENVELOPE_VERSION.equals(envelope.version())) {
                throw new IllegalArgumentException("Unsupported seed envelope version: " + envelope.version());
            }
            if (!ENVELOPE_ALGORITHM.equals(envelope.alg())) {
                throw new IllegalArgumentException("Unsupported seed envelope algorithm: " + envelope.alg());
            }
            byte[] iv = decodeBase64("iv", envelope.iv());
            if (iv.length != GCM_IV_BYTES) {
                throw new IllegalArgumentException("Seed envelope iv must be 12 bytes");
            }

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, secretKey(envelope.kid()), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(aad(envelope.kid()));
            return cipher.doFinal(decodeBase64("ciphertext", envelope.ct()));
        } catch (IllegalArgumentException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Unable to open committed seed envelope", ex);
        }
    }

    private String activeKeyId() {
        String keyId = commitSecurityProperties.getActiveStorageKeyId();
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Active storage key id is not configured");
        }
        return keyId.trim();
    }

    private SecretKeySpec secretKey(String keyId) {
        Map<String, String> keys = commitSecurityProperties.getStorageKeys();
        String encoded = keys == null ? null : keys.get(keyId);
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Storage key is not configured for key id: " + keyId);
        }
        byte[] keyBytes = decodeBase64("storage key", encoded);
        if (keyBytes.length != AES_KEY_BYTES) {
            throw new IllegalArgumentException("Storage key must decode to exactly 32 bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    private static byte[] aad(String keyId) {
        return ("mwor-seed-envelope|" + ENVELOPE_VERSION + "|" + keyId).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] decodeBase64(String fieldName, String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new IllegalArgumentException("Invalid base64 value for " + fieldName, ex);
        }
    }

    private record SeedEnvelope(
            String version,
            String alg,
            String kid,
            String iv,
            String ct
    ) {
    }
}

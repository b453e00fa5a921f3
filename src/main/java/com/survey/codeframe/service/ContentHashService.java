package com.survey.codeframe.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 fingerprints of answer texts, used to decide whether a cached embedding is stale.
 */
@Service
@Slf4j
public class ContentHashService {

    private static final String HASH_ALGORITHM = "SHA-256";

    /**
     * @return 64-char lowercase hex hash, or null if text is null
     */
    public String generateHash(String text) {
        if (text == null) {
            return null;
        }

        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hashBytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new IllegalStateException("Failed to hash answer text", e);
        }
    }

    public boolean hasTextChanged(String newHash, String storedHash) {
        if (newHash == null || storedHash == null) {
            return newHash != storedHash;
        }
        return !newHash.equals(storedHash);
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String h = Integer.toHexString(0xff & b);
            if (h.length() == 1) {
                hex.append('0');
            }
            hex.append(h);
        }
        return hex.toString();
    }
}

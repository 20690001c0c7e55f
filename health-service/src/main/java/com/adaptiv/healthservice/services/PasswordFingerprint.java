package com.adaptiv.healthservice.services;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of a stored password hash. Embedded in reset tokens so a token stops
 * working as soon as the password it was issued for has changed.
 */
@Component
public class PasswordFingerprint {

    public String of(String passwordHash) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(passwordHash.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public boolean matches(String passwordHash, String fingerprint) {
        if (fingerprint == null) {
            return false;
        }
        return MessageDigest.isEqual(of(passwordHash).getBytes(StandardCharsets.UTF_8),
                fingerprint.getBytes(StandardCharsets.UTF_8));
    }
}

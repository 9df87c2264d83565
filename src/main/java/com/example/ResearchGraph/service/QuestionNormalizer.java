package com.example.ResearchGraph.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Turns a question into the fingerprint used as the cache key.
 * Questions that differ only in case or surrounding whitespace share a fingerprint.
 */
@Component
public class QuestionNormalizer {

    /**
     * @return lowercase hex SHA-256 of the canonical form, 64 characters
     */
    public String normalize(String question) {
        return sha256Hex(canonicalize(question));
    }

    public String canonicalize(String question) {
        return question == null ? "" : question.trim().toLowerCase(Locale.ROOT);
    }

    private String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.example.ResearchGraph.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifier helpers for papers.
 *
 * <p>A paper's internal id is the version 5 (SHA-1, URL namespace) UUID of its
 * unversioned arXiv id, so re-ingesting a paper always lands on the same row.</p>
 */
public final class PaperIds {

    static final UUID NAMESPACE_URL = UUID.fromString("6ba7b811-9dad-11d1-80b4-00c04fd430c8");

    private static final Pattern VERSION_SUFFIX = Pattern.compile("v\\d+$");
    private static final Pattern ARXIV_PREFIX = Pattern.compile("^arxiv:", Pattern.CASE_INSENSITIVE);

    private PaperIds() {
    }

    public static UUID fromArxivId(String arxivId) {
        return nameBased(NAMESPACE_URL, arxivId);
    }

    /**
     * "arXiv:2401.01234v2" -> "2401.01234".
     */
    public static String stripVersion(String arxivId) {
        if (arxivId == null) {
            return null;
        }
        String id = ARXIV_PREFIX.matcher(arxivId.trim()).replaceFirst("");
        return VERSION_SUFFIX.matcher(id).replaceFirst("");
    }

    public static Optional<UUID> parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    static UUID nameBased(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }

        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50;  // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;  // IETF variant

        ByteBuffer bytes = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bytes.getLong(), bytes.getLong());
    }
}

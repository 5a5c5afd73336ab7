package com.portkit.core.util;

import com.portkit.core.model.Artifact;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * SHA-256 fingerprints of generated artifacts.
 *
 * <p>Fingerprints are lower-case hex strings of 64 characters. They are stored
 * in checkpoint records and compared between attempts to detect a collaborator
 * returning the same artifacts again.
 */
public final class Fingerprints {

    private static final String ALGORITHM = "SHA-256";

    private Fingerprints() {
        // Utility class
    }

    /**
     * Hashes text content encoded as UTF-8.
     *
     * @param content content to hash
     * @return 64-character hex digest
     * @throws IllegalArgumentException if content is null
     */
    public static String sha256(String content) {
        if (content == null) {
            throw new IllegalArgumentException("Content must not be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " algorithm not available", e);
        }
    }

    /**
     * Fingerprints every artifact of a set by role.
     *
     * @param artifacts artifact set
     * @return digest per role
     */
    public static Map<ArtifactRole, String> of(ArtifactSet artifacts) {
        Map<ArtifactRole, String> fingerprints = new EnumMap<>(ArtifactRole.class);
        for (Artifact artifact : artifacts.artifacts()) {
            fingerprints.put(artifact.role(), sha256(artifact.content()));
        }
        return fingerprints;
    }
}

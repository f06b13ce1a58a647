package com.logwatch.anomaly.engine.ingest;

import com.logwatch.anomaly.config.EngineConfig;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Pseudonymizes caller identifiers before they are counted or stored.
 * Salted SHA-256, first 16 hex characters.
 */
@Component
public class SourceHasher {

    private static final int HASH_HEX_LENGTH = 16;

    private final boolean enabled;
    private final byte[] salt;

    public SourceHasher(EngineConfig config) {
        this.enabled = config.isIpHashing();
        this.salt = config.getIpHashSalt() == null
                ? new byte[0]
                : config.getIpHashSalt().getBytes(StandardCharsets.UTF_8);
    }

    public String hash(String sourceId) {
        if (sourceId == null) return null;
        if (!enabled) return sourceId;

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(salt);
            byte[] hashed = digest.digest(sourceId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}

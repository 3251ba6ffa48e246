package com.example.prr.service;

import com.example.prr.exception.ArtifactNotFoundException;
import com.example.prr.exception.InvalidInputException;
import com.example.prr.model.UploadedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-lifetime artifact store keyed by the SHA-256 of MIME type and content.
 * Reads are lock-free; {@link ConcurrentMap#computeIfAbsent} serializes the single write per id.
 */
@Service
public class InMemoryArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactStore.class);

    private final ConcurrentMap<String, UploadedArtifact> artifacts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryArtifactStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UploadedArtifact put(byte[] bytes, String mimeType, String filename) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException("Empty file. Please upload a valid architecture diagram.");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new InvalidInputException("Missing MIME type for uploaded file");
        }
        String normalizedType = mimeType.trim().toLowerCase(Locale.ROOT);
        String id = contentId(bytes, normalizedType);

        UploadedArtifact stored = artifacts.computeIfAbsent(id,
                key -> new UploadedArtifact(key, bytes, normalizedType, filename, clock.instant()));
        log.info("Stored artifact {} ('{}', {}, {} bytes)", id, filename, normalizedType, bytes.length);
        return stored;
    }

    @Override
    public UploadedArtifact get(String id) {
        return find(id).orElseThrow(() -> new ArtifactNotFoundException(id));
    }

    @Override
    public Optional<UploadedArtifact> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(artifacts.get(id));
    }

    private static String contentId(byte[] bytes, String mimeType) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(mimeType.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(bytes);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.example.prr.model;

import java.time.Instant;
import java.util.Arrays;

/**
 * An uploaded architecture diagram held by the artifact store.
 *
 * @param id        Content-derived identifier, stable for identical uploads
 * @param bytes     Raw file content
 * @param mimeType  MIME type reported at upload time
 * @param filename  Original file name, if known
 * @param createdAt Time the artifact was first stored
 */
public record UploadedArtifact(
        String id,
        byte[] bytes,
        String mimeType,
        String filename,
        Instant createdAt
) {
    public UploadedArtifact {
        bytes = bytes != null ? bytes.clone() : new byte[0];
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadedArtifact other)) return false;
        return id.equals(other.id) && Arrays.equals(bytes, other.bytes)
                && mimeType.equals(other.mimeType);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "UploadedArtifact[id=%s, mimeType=%s, filename=%s, size=%d]"
                .formatted(id, mimeType, filename, bytes.length);
    }
}

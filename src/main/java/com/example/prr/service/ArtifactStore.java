package com.example.prr.service;

import com.example.prr.exception.ArtifactNotFoundException;
import com.example.prr.model.UploadedArtifact;

import java.util.Optional;

/**
 * Content-addressable holder of uploaded diagrams.
 * Artifacts are user data: they are never evicted or mutated once stored.
 */
public interface ArtifactStore {

    /**
     * Stores the bytes and returns the artifact. Storing identical content twice
     * returns the artifact created by the first call.
     *
     * @param bytes    file content (non-empty)
     * @param mimeType reported MIME type
     * @param filename original file name, may be {@code null}
     * @return the stored artifact
     */
    UploadedArtifact put(byte[] bytes, String mimeType, String filename);

    /**
     * @throws ArtifactNotFoundException if no artifact has the given id
     */
    UploadedArtifact get(String id);

    Optional<UploadedArtifact> find(String id);
}

package com.example.prr.exception;

/**
 * The requested artifact id is not in the store.
 */
public class ArtifactNotFoundException extends InvalidInputException {

    private final String artifactId;

    public ArtifactNotFoundException(String artifactId) {
        super("Artifact not found: " + artifactId + ". Please upload the file again.");
        this.artifactId = artifactId;
    }

    public String artifactId() {
        return artifactId;
    }
}

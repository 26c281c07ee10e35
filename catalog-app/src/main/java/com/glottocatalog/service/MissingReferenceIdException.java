package com.glottocatalog.service;

/**
 * Thrown when a source record carries no usable permanent identifier. Aborts the import run.
 */
public class MissingReferenceIdException extends RuntimeException {

    private final String bibtexKey;

    public MissingReferenceIdException(String bibtexKey, String message) {
        super(message);
        this.bibtexKey = bibtexKey;
    }

    public String getBibtexKey() {
        return bibtexKey;
    }
}

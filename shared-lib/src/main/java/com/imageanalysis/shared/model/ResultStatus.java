package com.imageanalysis.shared.model;

/**
 * Outcome marker stored with every result so a partial result never looks
 * like a complete one, and an image where every analyzer failed is flagged.
 */
public enum ResultStatus {
    COMPLETE,
    PARTIAL,
    FAILED
}

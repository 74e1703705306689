package org.filemetrics.metrics;

/**
 * Outcome of processing one file.
 */
public enum Status {
    SUCCESS, // Every line or record validated
    PARTIAL, // Readable, some lines invalid, at least one valid
    FAILURE  // Unreadable, undecodable, unsupported, timed out, or nothing valid
}

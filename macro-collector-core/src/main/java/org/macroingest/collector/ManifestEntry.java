package org.macroingest.collector;

/**
 * A unit skipped by a run.
 *
 * @param unitKey the unit key
 * @param errorType why it was skipped
 * @param message error description
 */
public record ManifestEntry(String unitKey, ErrorType errorType, String message) {
}

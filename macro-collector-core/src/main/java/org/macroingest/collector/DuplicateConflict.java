package org.macroingest.collector;

/**
 * Two discoveries of the same fingerprint whose fields disagree. The first discovery is
 * kept and the conflict is reported, never merged.
 *
 * @param fingerprint the shared fingerprint
 * @param kept the first-discovered record
 * @param discarded the later record
 */
public record DuplicateConflict(String fingerprint, NormalizedRecord kept, NormalizedRecord discarded) {
}

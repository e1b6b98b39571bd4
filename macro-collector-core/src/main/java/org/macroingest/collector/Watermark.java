package org.macroingest.collector;

import java.time.Instant;

/**
 * Highest cursor collected successfully for one (source, dataset).
 *
 * @param source source identifier
 * @param dataset dataset name
 * @param cursor the collected-through position
 * @param updatedAt when the watermark last moved
 */
public record Watermark(String source, String dataset, Instant cursor, Instant updatedAt) {
}

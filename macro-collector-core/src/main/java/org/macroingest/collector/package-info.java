/**
 * Collection framework: politeness, retries, cost limits, watermarks, deduplication and
 * the orchestrator that drives a {@link org.macroingest.collector.SourceAdapter} into the
 * raw store.
 *
 * <p>
 * Null-marked: references are non-null unless annotated with @Nullable.
 */
@NullMarked
package org.macroingest.collector;

import org.jspecify.annotations.NullMarked;

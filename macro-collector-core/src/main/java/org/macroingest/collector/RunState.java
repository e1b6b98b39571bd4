package org.macroingest.collector;

/**
 * Phases of the collection state machine.
 *
 * <p>
 * A run moves {@code IDLE -> ENUMERATING -> FETCHING_UNIT} and ends in {@code IDLE} or
 * {@code FAILED}. Each unit passes through {@code FETCHING_UNIT -> NORMALIZING ->
 * DEDUPLICATING -> EXPORTING}.
 */
public enum RunState {

	IDLE, ENUMERATING, FETCHING_UNIT, NORMALIZING, DEDUPLICATING, EXPORTING, FAILED

}

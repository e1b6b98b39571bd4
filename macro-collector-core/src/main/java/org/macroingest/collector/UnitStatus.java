package org.macroingest.collector;

/**
 * Final status of a unit within a run.
 */
public enum UnitStatus {

	SUCCEEDED, FAILED, CANCELLED

}

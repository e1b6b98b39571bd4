package org.macroingest.collector;

import java.time.Clock;

/**
 * Shared plumbing handed to every adapter, so that secondary requests an adapter makes on
 * its own (article pages, dry runs) pass through the same governor and retry engine as
 * the orchestrator's fetches.
 *
 * @param client HTTP client
 * @param engine retry engine, wrapping the rate governor
 * @param retryPolicy retry policy for this run
 * @param clock clock used for collection timestamps
 */
public record SourceContext(SourceClient client, ResilienceEngine engine, RetryPolicy retryPolicy, Clock clock) {

	public RateGovernor governor() {
		return engine.getGovernor();
	}

}

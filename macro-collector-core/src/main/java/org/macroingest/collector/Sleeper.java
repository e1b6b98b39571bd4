package org.macroingest.collector;

import java.time.Duration;

/**
 * The single place where the framework suspends a thread. Politeness delays and retry
 * backoff go through a {@code Sleeper} so that they can be observed and skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> {
		if (!duration.isNegative() && !duration.isZero()) {
			Thread.sleep(duration.toMillis());
		}
	};

	/**
	 * Suspend the calling thread.
	 * @param duration how long to sleep; zero or negative returns immediately
	 * @throws InterruptedException if the thread is interrupted while sleeping, which is
	 * how a run deadline cancels in-flight work
	 */
	void sleep(Duration duration) throws InterruptedException;

}

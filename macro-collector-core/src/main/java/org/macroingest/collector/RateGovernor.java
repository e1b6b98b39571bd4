package org.macroingest.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-source politeness governor. Every outbound request to a source first calls
 * {@link #acquire(String)}, which blocks until at least
 * {@code minInterval + jitter} has elapsed since the previous permit for that source.
 *
 * <p>
 * Waiting callers of the same source are served first-come-first-served through a fair
 * lock. Sources are independent of each other.
 *
 * <pre>
 * {@code
 * RateGovernor governor = RateGovernor.builder()
 *     .defaultPolicy(PolitenessPolicy.fixed(Duration.ofMillis(500)))
 *     .policy("calendar", new PolitenessPolicy(Duration.ZERO, Duration.ofSeconds(3), Duration.ofSeconds(5)))
 *     .build();
 * }
 * </pre>
 */
public final class RateGovernor {

	private static final Logger logger = LoggerFactory.getLogger(RateGovernor.class);

	private final Map<String, PolitenessPolicy> policies;

	private final PolitenessPolicy defaultPolicy;

	private final Clock clock;

	private final Sleeper sleeper;

	private final Random random;

	private final Map<String, SourceSlot> slots = new ConcurrentHashMap<>();

	private RateGovernor(Builder builder) {
		this.policies = Map.copyOf(builder.policies);
		this.defaultPolicy = builder.defaultPolicy;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
		this.random = builder.random;
	}

	/**
	 * Create a new builder for RateGovernor.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Block until the next request to {@code sourceId} is allowed.
	 * @param sourceId the source to acquire a permit for
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public void acquire(String sourceId) throws InterruptedException {
		SourceSlot slot = slots.computeIfAbsent(sourceId, id -> new SourceSlot());
		slot.lock.lockInterruptibly();
		try {
			if (slot.lastPermit != null) {
				Duration gap = gapFor(policyFor(sourceId));
				Duration wait = Duration.between(clock.instant(), slot.lastPermit.plus(gap));
				if (!wait.isNegative() && !wait.isZero()) {
					logger.debug("Politeness wait of {}ms before next {} request", wait.toMillis(), sourceId);
					sleeper.sleep(wait);
				}
			}
			slot.lastPermit = clock.instant();
		}
		finally {
			slot.lock.unlock();
		}
	}

	/**
	 * Returns the policy applied to a source.
	 * @param sourceId the source
	 * @return the configured policy, or the default policy
	 */
	public PolitenessPolicy policyFor(String sourceId) {
		return policies.getOrDefault(sourceId, defaultPolicy);
	}

	/**
	 * Returns the instant of the last permit granted for a source.
	 * @param sourceId the source
	 * @return last permit, or {@code null} if none was granted yet
	 */
	@Nullable
	public Instant lastPermit(String sourceId) {
		SourceSlot slot = slots.get(sourceId);
		return slot != null ? slot.lastPermit : null;
	}

	private Duration gapFor(PolitenessPolicy policy) {
		long minJitter = policy.jitterMin().toNanos();
		long span = policy.jitterMax().toNanos() - minJitter;
		long jitter = minJitter;
		if (span > 0) {
			synchronized (random) {
				jitter += (long) (random.nextDouble() * span);
			}
		}
		return policy.minInterval().plusNanos(jitter);
	}

	private static final class SourceSlot {

		private final ReentrantLock lock = new ReentrantLock(true);

		@Nullable
		private volatile Instant lastPermit;

	}

	/**
	 * Builder for {@link RateGovernor}.
	 *
	 * <p>
	 * Defaults: no spacing, system UTC clock, {@link Sleeper#SYSTEM}.
	 */
	public static class Builder {

		private final Map<String, PolitenessPolicy> policies = new HashMap<>();

		private PolitenessPolicy defaultPolicy = PolitenessPolicy.none();

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Random random = new Random();

		private Builder() {
		}

		/**
		 * Set the policy for sources without a specific one.
		 * @param policy the default policy
		 * @return this builder
		 */
		public Builder defaultPolicy(PolitenessPolicy policy) {
			this.defaultPolicy = policy;
			return this;
		}

		/**
		 * Set the policy for one source.
		 * @param sourceId the source
		 * @param policy the policy
		 * @return this builder
		 */
		public Builder policy(String sourceId, PolitenessPolicy policy) {
			this.policies.put(sourceId, policy);
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the random source used to draw jitter. Tests pass a seeded instance.
		 * @param random the random source
		 * @return this builder
		 */
		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		public RateGovernor build() {
			return new RateGovernor(this);
		}

	}

}

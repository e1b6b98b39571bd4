package org.macroingest.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fingerprint based deduplication across and within runs.
 *
 * <p>
 * The seen set holds fingerprints already exported (loaded from the raw store through
 * {@link SeenSetLoader}) and only ever grows. While a run is in flight, a unit
 * {@linkplain #claim(String, List) claims} the fingerprints it keeps; a claimed fingerprint
 * is not new for any other unit. After the unit's export succeeds its claims are
 * {@linkplain #commit(String) committed} to the seen set, and if the export fails they are
 * {@linkplain #release(String) released}.
 *
 * <p>
 * Tie-break: first-discovered wins. A later record whose fields differ from the kept one is
 * reported as a {@link DuplicateConflict} and logged.
 */
public class Deduplicator {

	private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

	private final ReentrantLock lock = new ReentrantLock();

	private final Set<String> seen = new HashSet<>();

	private final Map<String, Claim> claims = new HashMap<>();

	public Deduplicator() {
	}

	public Deduplicator(Collection<String> exportedFingerprints) {
		this.seen.addAll(exportedFingerprints);
	}

	/**
	 * Whether a fingerprint is neither exported nor claimed by an in-flight unit.
	 * @param fingerprint the fingerprint
	 * @return true if new
	 */
	public boolean isNew(String fingerprint) {
		lock.lock();
		try {
			return !seen.contains(fingerprint) && !claims.containsKey(fingerprint);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Add a fingerprint to the seen set.
	 * @param fingerprint the fingerprint
	 */
	public void markSeen(String fingerprint) {
		lock.lock();
		try {
			seen.add(fingerprint);
			claims.remove(fingerprint);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Filter a standalone batch and mark the survivors seen immediately.
	 * @param records the batch
	 * @return kept records, duplicates and conflicts
	 */
	public DeduplicationOutcome filter(List<NormalizedRecord> records) {
		String owner = "batch-" + System.identityHashCode(records);
		lock.lock();
		try {
			DeduplicationOutcome outcome = claim(owner, records);
			commit(owner);
			return outcome;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Filter a unit's batch, claiming the fingerprints of the kept records for
	 * {@code owner}.
	 * @param owner key of the unit claiming the fingerprints
	 * @param records the batch, in discovery order
	 * @return kept records, duplicates and conflicts
	 */
	public DeduplicationOutcome claim(String owner, List<NormalizedRecord> records) {
		List<NormalizedRecord> kept = new ArrayList<>();
		List<NormalizedRecord> duplicates = new ArrayList<>();
		List<DuplicateConflict> conflicts = new ArrayList<>();

		lock.lock();
		try {
			for (NormalizedRecord record : records) {
				String fingerprint = record.fingerprint();
				if (fingerprint == null) {
					kept.add(record);
					continue;
				}
				if (seen.contains(fingerprint)) {
					duplicates.add(record);
					continue;
				}
				Claim existing = claims.get(fingerprint);
				if (existing != null) {
					duplicates.add(record);
					if (!existing.record().fields().equals(record.fields())) {
						DuplicateConflict conflict = new DuplicateConflict(fingerprint, existing.record(), record);
						conflicts.add(conflict);
						logger.warn("Conflicting duplicate {} ({}): keeping first discovery from {}", fingerprint,
								record.field("url"), existing.owner());
					}
					continue;
				}
				claims.put(fingerprint, new Claim(owner, record));
				kept.add(record);
			}
		}
		finally {
			lock.unlock();
		}

		if (!duplicates.isEmpty()) {
			logger.info("{}: kept {} record(s), dropped {} duplicate(s)", owner, kept.size(), duplicates.size());
		}
		return new DeduplicationOutcome(kept, duplicates, conflicts);
	}

	/**
	 * Move every fingerprint claimed by {@code owner} into the seen set.
	 * @param owner the unit key
	 * @return number of fingerprints committed
	 */
	public int commit(String owner) {
		lock.lock();
		try {
			int committed = 0;
			Iterator<Map.Entry<String, Claim>> it = claims.entrySet().iterator();
			while (it.hasNext()) {
				Map.Entry<String, Claim> entry = it.next();
				if (entry.getValue().owner().equals(owner)) {
					seen.add(entry.getKey());
					it.remove();
					committed++;
				}
			}
			return committed;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Drop every fingerprint claimed by {@code owner} without marking it seen.
	 * @param owner the unit key
	 * @return number of fingerprints released
	 */
	public int release(String owner) {
		lock.lock();
		try {
			int before = claims.size();
			claims.values().removeIf(claim -> claim.owner().equals(owner));
			return before - claims.size();
		}
		finally {
			lock.unlock();
		}
	}

	public int seenCount() {
		lock.lock();
		try {
			return seen.size();
		}
		finally {
			lock.unlock();
		}
	}

	private record Claim(String owner, NormalizedRecord record) {
	}

}

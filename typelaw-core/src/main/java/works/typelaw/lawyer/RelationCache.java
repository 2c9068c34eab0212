package works.typelaw.lawyer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.types.TypeId;

/**
 * Remembers assignability answers across queries.
 * <p>
 * Only answers that were actually proven are stored; a truncated query's
 * conservative answer might change with larger budgets, so it is never cached.
 * Once the cache holds <code>maxEntries</code> answers it stops taking new ones.
 */
public final class RelationCache {
	private final int maxEntries;
	private final ConcurrentHashMap<Key, AssignabilityResult> results = new ConcurrentHashMap<>();
	private final AtomicLong hits = new AtomicLong();
	private final AtomicLong misses = new AtomicLong();

	record Key(TypeId source, TypeId target, CompatProfile profile) { }

	public RelationCache(int maxEntries) {
		if (maxEntries <= 0) {
			throw new IllegalArgumentException("maxEntries must be positive; got " + maxEntries);
		}
		this.maxEntries = maxEntries;
	}

	public @Nullable AssignabilityResult get(TypeId source, TypeId target, CompatProfile profile) {
		AssignabilityResult result = results.get(new Key(source, target, profile));
		if (result == null) {
			misses.incrementAndGet();
		} else {
			hits.incrementAndGet();
		}
		return result;
	}

	public void put(TypeId source, TypeId target, CompatProfile profile, AssignabilityResult result) {
		if (result.truncated()) {
			return;
		}
		if (results.size() >= maxEntries) {
			LOGGER.trace("Relation cache full at {} entries", maxEntries);
			return;
		}
		results.putIfAbsent(new Key(source, target, profile), result);
	}

	public int size() {
		return results.size();
	}

	public long hits() {
		return hits.get();
	}

	public long misses() {
		return misses.get();
	}

	public void clear() {
		results.clear();
	}

	@Override
	public String toString() {
		return "RelationCache{" +
			"size=" + results.size() +
			", maxEntries=" + maxEntries +
			", hits=" + hits.get() +
			", misses=" + misses.get() +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RelationCache.class);
}

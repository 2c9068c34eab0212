package works.typelaw.types;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import works.typelaw.exceptions.InvalidTypeException;

/**
 * Thread-safe hash-consing table: each distinct value gets one stable integer id.
 * <p>
 * Values are spread across {@value #SHARD_COUNT} shards by hash, each with its own
 * lookup map and append-only arena, so concurrent interning of unrelated values
 * rarely contends. An id encodes its shard in the low {@value #SHARD_BITS} bits
 * and the arena slot in the rest, plus a fixed offset.
 */
final class ShardedTable<V> {
	static final int SHARD_BITS = 6;
	static final int SHARD_COUNT = 1 << SHARD_BITS;
	private static final int SHARD_MASK = SHARD_COUNT - 1;

	private final String name;
	private final int offset;
	private final Shard<V>[] shards;

	@SuppressWarnings("unchecked")
	ShardedTable(String name, int offset) {
		this.name = name;
		this.offset = offset;
		this.shards = new Shard[SHARD_COUNT];
		for (int i = 0; i < SHARD_COUNT; i++) {
			shards[i] = new Shard<>();
		}
	}

	int intern(V value) {
		int shardIndex = spread(value.hashCode()) & SHARD_MASK;
		int slot = shards[shardIndex].intern(value);
		return offset + ((slot << SHARD_BITS) | shardIndex);
	}

	V get(int id) {
		int relative = id - offset;
		if (relative < 0) {
			throw new InvalidTypeException("Id " + id + " does not belong to " + name + " table");
		}
		V result = shards[relative & SHARD_MASK].arena.get(relative >>> SHARD_BITS);
		if (result == null) {
			throw new InvalidTypeException("Id " + id + " was not issued by this " + name + " table");
		}
		return result;
	}

	int size() {
		int result = 0;
		for (Shard<V> shard : shards) {
			result += shard.arena.size();
		}
		return result;
	}

	private static int spread(int h) {
		return h ^ (h >>> 16) ^ (h >>> 7);
	}

	private static final class Shard<V> {
		final ConcurrentHashMap<V, Integer> ids = new ConcurrentHashMap<>();
		final Arena<V> arena = new Arena<>();

		int intern(V value) {
			Integer existing = ids.get(value);
			if (existing != null) {
				return existing;
			}
			// The arena append happens at most once per value because
			// computeIfAbsent runs the mapping function atomically.
			return ids.computeIfAbsent(value, arena::append);
		}
	}

	/**
	 * Append-only storage in fixed-size chunks. Readers never block,
	 * and an existing slot never moves.
	 */
	private static final class Arena<V> {
		private static final int CHUNK_BITS = 10;
		private static final int CHUNK_SIZE = 1 << CHUNK_BITS;
		private static final int MAX_CHUNKS = 1 << 14;

		private final AtomicInteger next = new AtomicInteger();
		private final AtomicReferenceArray<AtomicReferenceArray<V>> chunks = new AtomicReferenceArray<>(MAX_CHUNKS);

		int append(V value) {
			int slot = next.getAndIncrement();
			int chunkIndex = slot >>> CHUNK_BITS;
			if (chunkIndex >= MAX_CHUNKS) {
				throw new IllegalStateException("Interner arena is full");
			}
			AtomicReferenceArray<V> chunk = chunks.get(chunkIndex);
			if (chunk == null) {
				chunks.compareAndSet(chunkIndex, null, new AtomicReferenceArray<>(CHUNK_SIZE));
				chunk = chunks.get(chunkIndex);
			}
			chunk.set(slot & (CHUNK_SIZE - 1), value);
			return slot;
		}

		V get(int slot) {
			int chunkIndex = slot >>> CHUNK_BITS;
			if (chunkIndex >= MAX_CHUNKS) {
				return null;
			}
			AtomicReferenceArray<V> chunk = chunks.get(chunkIndex);
			return (chunk == null) ? null : chunk.get(slot & (CHUNK_SIZE - 1));
		}

		int size() {
			return next.get();
		}
	}
}

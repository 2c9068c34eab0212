package works.typelaw.guard;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Memoizes recursive yes/no questions whose answers may depend on themselves,
 * such as whether one recursive type is a subtype of another.
 * <p>
 * A question asked again while it is still being answered is assumed to hold.
 * This is the coinductive reading that makes recursive structural types
 * comparable at all. A positive answer that leaned on such an assumption is
 * only cached once the assumed question itself completes; negative answers
 * are always safe to cache.
 * <p>
 * Not thread-safe. Each query gets its own tracker.
 */
public final class CycleTracker<K> {
	public enum Status {
		/**
		 * The caller must compute the answer and then call {@link #finish} or {@link #abandon}.
		 */
		STARTED,
		/**
		 * The question is already being answered further up; assume it holds.
		 */
		IN_PROGRESS,
		PROVEN,
		DISPROVEN,
		/**
		 * Too many questions are open at once.
		 */
		OVERFLOW,
	}

	private final int maxInProgress;
	private final Map<K, Boolean> results = new HashMap<>();
	private final Map<K, Integer> inProgress = new HashMap<>();
	private final List<Frame<K>> stack = new ArrayList<>();

	public CycleTracker(int maxInProgress) {
		this.maxInProgress = maxInProgress;
	}

	public Status begin(K key) {
		Boolean known = results.get(key);
		if (known != null) {
			return known ? Status.PROVEN : Status.DISPROVEN;
		}
		Integer frameIndex = inProgress.get(key);
		if (frameIndex != null) {
			if (!stack.isEmpty()) {
				Frame<K> top = stack.get(stack.size() - 1);
				top.minDependency = Math.min(top.minDependency, frameIndex);
			}
			return Status.IN_PROGRESS;
		}
		if (inProgress.size() >= maxInProgress) {
			return Status.OVERFLOW;
		}
		inProgress.put(key, stack.size());
		stack.add(new Frame<>(key));
		return Status.STARTED;
	}

	public void finish(K key, boolean result) {
		Frame<K> frame = pop(key);
		if (frame.minDependency < stack.size()) {
			// Leaned on an ancestor that is still open
			propagate(frame);
			if (!result) {
				results.put(key, false);
			}
		} else {
			results.put(key, result);
		}
	}

	/**
	 * Closes a question without recording any answer, as when a budget runs out.
	 */
	public void abandon(K key) {
		Frame<K> frame = pop(key);
		if (frame.minDependency < stack.size()) {
			propagate(frame);
		}
	}

	public int openCount() {
		return inProgress.size();
	}

	private void propagate(Frame<K> frame) {
		Frame<K> parent = stack.get(stack.size() - 1);
		parent.minDependency = Math.min(parent.minDependency, frame.minDependency);
	}

	private Frame<K> pop(K key) {
		int index = stack.size() - 1;
		if (index < 0 || !stack.get(index).key.equals(key)) {
			throw new IllegalStateException("Unbalanced cycle tracking for " + key);
		}
		inProgress.remove(key);
		return stack.remove(index);
	}

	private static final class Frame<K> {
		final K key;
		int minDependency = Integer.MAX_VALUE;

		Frame(K key) {
			this.key = key;
		}
	}
}

package works.typelaw.judge;

import java.util.Set;
import works.typelaw.guard.Budget;

/**
 * @param truncated true if a budget ran out, so <code>holds</code> is a conservative
 *                  <code>false</code> rather than a proven answer
 */
public record RelationResult(boolean holds, boolean truncated, Set<Budget> exhausted) {
	public RelationResult {
		exhausted = Set.copyOf(exhausted);
	}

	public static RelationResult proven(boolean holds) {
		return new RelationResult(holds, false, Set.of());
	}
}

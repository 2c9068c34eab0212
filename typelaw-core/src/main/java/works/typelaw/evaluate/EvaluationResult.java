package works.typelaw.evaluate;

import java.util.Set;
import works.typelaw.guard.Budget;
import works.typelaw.types.TypeId;

/**
 * @param truncated true if a budget ran out, in which case {@link #type} is a conservative stand-in
 */
public record EvaluationResult(TypeId type, boolean truncated, Set<Budget> exhausted) {
	public EvaluationResult {
		exhausted = Set.copyOf(exhausted);
	}
}

package works.typelaw.lawyer;

import java.util.Optional;
import works.typelaw.judge.FailureReason;

import static java.util.Objects.requireNonNull;

/**
 * @param reason present exactly when <code>ok</code> is false
 * @param truncated true if a budget ran out; <code>ok</code> is then false and
 *                  the reason is {@link FailureReason.BudgetExceeded}
 */
public record AssignabilityResult(boolean ok, Optional<FailureReason> reason, boolean truncated) {
	public static final AssignabilityResult OK = new AssignabilityResult(true, Optional.empty(), false);

	public AssignabilityResult {
		requireNonNull(reason);
		if (ok == reason.isPresent()) {
			throw new IllegalArgumentException("An assignability result has a reason if and only if it fails");
		}
	}

	public static AssignabilityResult rejected(FailureReason reason) {
		return new AssignabilityResult(false, Optional.of(reason), false);
	}

	public static AssignabilityResult truncated(FailureReason.BudgetExceeded reason) {
		return new AssignabilityResult(false, Optional.of(reason), true);
	}
}

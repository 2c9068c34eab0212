package works.typelaw.judge;

import java.util.Set;
import works.typelaw.guard.Budget;
import works.typelaw.types.TypeId;

import static java.util.Objects.requireNonNull;

/**
 * Why a source type does not fit a target type.
 * Reasons nest, following the path from the outermost types to the innermost conflict.
 */
public sealed interface FailureReason {
	record PropertyMissing(String member) implements FailureReason { }

	record PropertyTypeMismatch(String member, FailureReason reason) implements FailureReason {
		public PropertyTypeMismatch {
			requireNonNull(reason);
		}
	}

	record ExcessProperty(String member) implements FailureReason { }

	record ParameterIncompatible(int index, FailureReason reason) implements FailureReason {
		public ParameterIncompatible {
			requireNonNull(reason);
		}
	}

	record ReturnIncompatible(FailureReason reason) implements FailureReason {
		public ReturnIncompatible {
			requireNonNull(reason);
		}
	}

	/**
	 * @param sourceRequired how many arguments the source requires
	 * @param targetAccepted how many arguments the target can supply; for tuples, the element counts
	 */
	record ArityMismatch(int sourceRequired, int targetAccepted) implements FailureReason { }

	record EnumOpacityViolation(TypeId source, TypeId target) implements FailureReason { }

	record BudgetExceeded(Set<Budget> budgets) implements FailureReason {
		public BudgetExceeded {
			budgets = Set.copyOf(budgets);
		}
	}

	/**
	 * The innermost conflict, when no more specific reason applies.
	 */
	record TypeMismatch(TypeId source, TypeId target) implements FailureReason { }

	/**
	 * An optional source member can't satisfy a required target member.
	 */
	record OptionalityMismatch(String member) implements FailureReason { }

	/**
	 * A readonly source member can't satisfy a mutable target member.
	 */
	record ReadonlyMismatch(String member) implements FailureReason { }

	/**
	 * The target is a weak type and the source shares none of its members.
	 */
	record NoCommonProperties(TypeId source, TypeId target) implements FailureReason { }
}

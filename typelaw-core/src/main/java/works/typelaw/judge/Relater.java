package works.typelaw.judge;

import org.jetbrains.annotations.Nullable;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.TypeId;

/**
 * The policy that decides how nested positions of a structural comparison are related.
 * <p>
 * {@link Judge} walks the structure of two types; every time it needs to
 * compare a member, parameter, return or element, it asks the active relater.
 * Judge's own relater is strict. Compatibility layers supply lenient ones.
 */
public interface Relater {
	/**
	 * Distinguishes this relater's answers from other relaters' in the per-query memo.
	 * Two relaters with equal modes must give equal answers.
	 */
	Object mode();

	/**
	 * Relates a nested pair. Implementations normally delegate to
	 * {@link Judge#relate(TypeId, TypeId, QueryContext, Relater)} passing themselves.
	 */
	boolean relate(TypeId source, TypeId target, QueryContext ctx);

	/**
	 * Decides a pair before Judge looks at its structure.
	 *
	 * @return null to let Judge decide
	 */
	default @Nullable Boolean preempt(TypeId source, TypeId target, QueryContext ctx) {
		return null;
	}

	/**
	 * If {@link #preempt} rejects a pair for a reason of its own, describes that reason.
	 */
	default @Nullable FailureReason preemptReason(TypeId source, TypeId target, QueryContext ctx) {
		return null;
	}

	/**
	 * @param method true if the target signature was declared as a method
	 */
	boolean relateParameter(TypeId sourceParameter, TypeId targetParameter, boolean method, QueryContext ctx);

	boolean relateReturn(TypeId sourceReturn, TypeId targetReturn, QueryContext ctx);

	/**
	 * Relates a source property type to the type of an optional target property.
	 */
	boolean relateOptionalProperty(TypeId sourceType, TypeId targetType, QueryContext ctx);

	/**
	 * @return true if a readonly source property may satisfy a mutable target property
	 */
	boolean allowsReadonlyToMutable();
}

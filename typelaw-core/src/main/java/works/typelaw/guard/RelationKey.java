package works.typelaw.guard;

import works.typelaw.types.TypeId;

import static java.util.Objects.requireNonNull;

/**
 * Memo key for one relation question.
 *
 * @param mode distinguishes relations with different rules, so that
 *             a strict and a lenient answer for the same pair never collide
 */
public record RelationKey(TypeId source, TypeId target, Object mode) {
	public RelationKey {
		requireNonNull(source);
		requireNonNull(target);
		requireNonNull(mode);
	}
}

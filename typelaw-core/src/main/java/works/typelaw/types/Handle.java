package works.typelaw.types;

/**
 * Index of a value interned in one of the side tables of a {@link TypeInterner},
 * such as a member list or an object shape.
 * The type parameter only records which table the handle belongs to.
 */
public record Handle<T>(int index) {
	@Override
	public String toString() {
		return "@" + index;
	}
}

package works.typelaw.types;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * @param rest true for a trailing <code>...T</code> element, whose type is an array or tuple
 */
public record TupleElement(TypeId type, @Nullable String label, boolean optional, boolean rest) {
	public TupleElement {
		requireNonNull(type);
		if (optional && rest) {
			throw new IllegalArgumentException("Tuple element can't be both optional and rest");
		}
	}

	public static TupleElement required(TypeId type) {
		return new TupleElement(type, null, false, false);
	}

	public static TupleElement optional(TypeId type) {
		return new TupleElement(type, null, true, false);
	}

	public static TupleElement rest(TypeId arrayType) {
		return new TupleElement(arrayType, null, false, true);
	}

	public TupleElement withType(TypeId type) {
		return new TupleElement(type, label, optional, rest);
	}
}

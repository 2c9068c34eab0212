package works.typelaw.types;

import org.jetbrains.annotations.NotNull;

/**
 * Opaque handle to a type interned in a {@link TypeInterner}.
 * Two ids are equal if and only if they denote the same structural type
 * within the same interner.
 * <p>
 * Ids below {@link #FIRST_DYNAMIC} are reserved for the well-known
 * intrinsic types and are identical across all interners.
 */
public record TypeId(int index) implements Comparable<TypeId> {
	public TypeId {
		if (index < 0) {
			throw new IllegalArgumentException("TypeId index can't be negative: " + index);
		}
	}

	public static final TypeId ANY = new TypeId(0);
	public static final TypeId UNKNOWN = new TypeId(1);
	public static final TypeId NEVER = new TypeId(2);
	public static final TypeId VOID = new TypeId(3);
	public static final TypeId NULL = new TypeId(4);
	public static final TypeId UNDEFINED = new TypeId(5);
	public static final TypeId BOOLEAN = new TypeId(6);
	public static final TypeId NUMBER = new TypeId(7);
	public static final TypeId STRING = new TypeId(8);
	public static final TypeId BIGINT = new TypeId(9);
	public static final TypeId SYMBOL = new TypeId(10);

	/**
	 * The non-primitive <code>object</code> type.
	 */
	public static final TypeId OBJECT = new TypeId(11);

	/**
	 * Stands in for a reference whose declaration could not be found.
	 * Relates only to itself.
	 */
	public static final TypeId UNRESOLVED = new TypeId(12);

	public static final TypeId TRUE = new TypeId(13);
	public static final TypeId FALSE = new TypeId(14);

	/**
	 * The object type with no members and no index signatures, written <code>{}</code>.
	 */
	public static final TypeId EMPTY_OBJECT = new TypeId(15);

	public static final int FIRST_DYNAMIC = 64;

	public boolean isIntrinsic() {
		return index < FIRST_DYNAMIC;
	}

	@Override
	public int compareTo(@NotNull TypeId other) {
		return Integer.compare(index, other.index);
	}

	@Override
	public String toString() {
		return "#" + index;
	}
}

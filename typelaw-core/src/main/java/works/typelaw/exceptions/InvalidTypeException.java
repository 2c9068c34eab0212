package works.typelaw.exceptions;

/**
 * A {@link works.typelaw.types.TypeId} or handle was used with an interner that did not issue it,
 * or a type was built from parts that can't go together.
 * Always indicates a bug in the caller.
 */
public final class InvalidTypeException extends TypeLawException {
	public InvalidTypeException(String message) {
		super(message);
	}

	public InvalidTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}

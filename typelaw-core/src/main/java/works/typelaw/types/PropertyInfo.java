package works.typelaw.types;

import static java.util.Objects.requireNonNull;

/**
 * A named member of an {@link ObjectShape}.
 * <p>
 * <code>readType</code> and <code>writeType</code> differ only for
 * properties declared with split accessors.
 *
 * @param method true if the member was declared with method syntax,
 *               which relaxes parameter checking in non-strict profiles
 */
public record PropertyInfo(
	String name,
	TypeId readType,
	TypeId writeType,
	boolean optional,
	boolean readonly,
	boolean method
) {
	public PropertyInfo {
		requireNonNull(name);
		requireNonNull(readType);
		requireNonNull(writeType);
	}

	public static PropertyInfo of(String name, TypeId type) {
		return new PropertyInfo(name, type, type, false, false, false);
	}

	public static PropertyInfo optional(String name, TypeId type) {
		return new PropertyInfo(name, type, type, true, false, false);
	}

	public static PropertyInfo readonly(String name, TypeId type) {
		return new PropertyInfo(name, type, type, false, true, false);
	}

	public static PropertyInfo method(String name, TypeId functionType) {
		return new PropertyInfo(name, functionType, functionType, false, false, true);
	}

	public static PropertyInfo accessor(String name, TypeId readType, TypeId writeType) {
		return new PropertyInfo(name, readType, writeType, false, false, false);
	}

	public boolean hasSplitAccessor() {
		return !readType.equals(writeType);
	}

	public PropertyInfo withType(TypeId type) {
		return new PropertyInfo(name, type, type, optional, readonly, method);
	}

	public PropertyInfo withTypes(TypeId readType, TypeId writeType) {
		return new PropertyInfo(name, readType, writeType, optional, readonly, method);
	}

	public PropertyInfo withName(String name) {
		return new PropertyInfo(name, readType, writeType, optional, readonly, method);
	}

	public PropertyInfo withOptional(boolean optional) {
		return new PropertyInfo(name, readType, writeType, optional, readonly, method);
	}

	public PropertyInfo withReadonly(boolean readonly) {
		return new PropertyInfo(name, readType, writeType, optional, readonly, method);
	}
}

package works.typelaw.types;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Declaration of a type parameter or <code>infer</code> placeholder.
 * Type parameters are matched by name during substitution,
 * so two parameters with the same name, constraint and default intern identically.
 */
public record TypeParamInfo(String name, @Nullable TypeId constraint, @Nullable TypeId defaultType) {
	public TypeParamInfo {
		requireNonNull(name);
	}

	public static TypeParamInfo of(String name) {
		return new TypeParamInfo(name, null, null);
	}

	public static TypeParamInfo constrained(String name, TypeId constraint) {
		return new TypeParamInfo(name, constraint, null);
	}

	public TypeParamInfo withDefault(TypeId defaultType) {
		return new TypeParamInfo(name, constraint, defaultType);
	}
}

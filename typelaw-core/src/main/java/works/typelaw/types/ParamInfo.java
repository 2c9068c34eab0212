package works.typelaw.types;

import static java.util.Objects.requireNonNull;

/**
 * @param rest true for a trailing <code>...name: T</code> parameter, whose type is an array or tuple
 */
public record ParamInfo(String name, TypeId type, boolean optional, boolean rest) {
	public ParamInfo {
		requireNonNull(name);
		requireNonNull(type);
	}

	public static ParamInfo of(String name, TypeId type) {
		return new ParamInfo(name, type, false, false);
	}

	public static ParamInfo optional(String name, TypeId type) {
		return new ParamInfo(name, type, true, false);
	}

	public static ParamInfo rest(String name, TypeId arrayType) {
		return new ParamInfo(name, arrayType, false, true);
	}

	public ParamInfo withType(TypeId type) {
		return new ParamInfo(name, type, optional, rest);
	}
}

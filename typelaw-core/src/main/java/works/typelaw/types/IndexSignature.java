package works.typelaw.types;

import static java.util.Objects.requireNonNull;

public record IndexSignature(TypeId valueType, boolean readonly) {
	public IndexSignature {
		requireNonNull(valueType);
	}

	public static IndexSignature of(TypeId valueType) {
		return new IndexSignature(valueType, false);
	}

	public IndexSignature withValueType(TypeId valueType) {
		return new IndexSignature(valueType, readonly);
	}
}

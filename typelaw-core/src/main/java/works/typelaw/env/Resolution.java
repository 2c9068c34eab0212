package works.typelaw.env;

import java.util.List;
import works.typelaw.types.DefId;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

/**
 * A declaration after lowering. Immutable and cached for the life of the environment.
 *
 * @param valueType {@link TypeId#UNRESOLVED} if the declaration introduces no value
 */
public record Resolution(
	DefId def,
	String name,
	DeclarationKind kind,
	List<TypeParamInfo> typeParameters,
	TypeId declaredType,
	TypeId valueType
) {
	public Resolution {
		typeParameters = List.copyOf(typeParameters);
	}

	public boolean isGeneric() {
		return !typeParameters.isEmpty();
	}
}
